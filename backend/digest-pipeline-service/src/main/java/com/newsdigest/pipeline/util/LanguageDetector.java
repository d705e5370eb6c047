package com.newsdigest.pipeline.util;

/**
 * Tells Japanese from English by the presence of Hiragana, Katakana or Han characters.
 */
public final class LanguageDetector {

    public static final String JAPANESE = "ja";
    public static final String ENGLISH = "en";

    private LanguageDetector() {
    }

    public static String detect(String... texts) {
        for (String text : texts) {
            if (containsJapanese(text)) {
                return JAPANESE;
            }
        }
        return ENGLISH;
    }

    public static boolean containsJapanese(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return text.codePoints().anyMatch(LanguageDetector::isJapanese);
    }

    public static boolean isJapanese(int cp) {
        Character.UnicodeScript script = Character.UnicodeScript.of(cp);
        return script == Character.UnicodeScript.HIRAGANA
                || script == Character.UnicodeScript.KATAKANA
                || script == Character.UnicodeScript.HAN;
    }
}
