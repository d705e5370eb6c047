package com.newsdigest.pipeline.client;

import com.newsdigest.pipeline.util.LanguageDetector;

/**
 * Summary prompt templates, Japanese (default) and English.
 */
public final class SummaryPrompts {

    static final String SYSTEM_MESSAGE = """
            You are a news editor. Reply with the summary only, without any preamble.
            """;

    private static final String JAPANESE = """
            以下のニュース記事を、簡潔な日本語で2-3文の要約にしてください。
            重要なポイントだけを抽出し、読者が記事の内容をすぐに理解できるようにしてください。

            記事：
            %s

            要約：""";

    private static final String ENGLISH = """
            Please summarize the following news article in 2-3 concise sentences.
            Extract only the key points so readers can quickly understand the content.

            Article:
            %s

            Summary:""";

    private SummaryPrompts() {
    }

    public static String build(String language, String articleText) {
        String template = LanguageDetector.ENGLISH.equalsIgnoreCase(language) ? ENGLISH : JAPANESE;
        return template.formatted(articleText);
    }
}
