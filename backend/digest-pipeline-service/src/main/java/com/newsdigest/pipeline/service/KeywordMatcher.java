package com.newsdigest.pipeline.service;

import com.newsdigest.pipeline.entity.CanonicalArticle;
import com.newsdigest.pipeline.util.LanguageDetector;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds configured keywords in an article's title, description and content.
 *
 * Matching is case-insensitive. Latin terms must not touch other Latin letters or digits ("AI"
 * does not match "said" but does match "新しいAIモデル"); Japanese terms match as substrings.
 */
@Component
public class KeywordMatcher {

    /**
     * @return matched keywords in configuration order, as configured
     */
    public Set<String> match(CanonicalArticle article, List<String> keywords) {
        String haystack = String.join("\n",
                article.getTitle(),
                nullToEmpty(article.getDescription()),
                nullToEmpty(article.getContent()));
        String lower = haystack.toLowerCase(Locale.ROOT);

        Set<String> matched = new LinkedHashSet<>();
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String term = keyword.strip();
            boolean found = LanguageDetector.containsJapanese(term)
                    ? lower.contains(term.toLowerCase(Locale.ROOT))
                    : wholeWord(term).matcher(haystack).find();
            if (found) {
                matched.add(term);
            }
        }
        return matched;
    }

    private static Pattern wholeWord(String term) {
        return Pattern.compile("(?<![A-Za-z0-9])" + Pattern.quote(term) + "(?![A-Za-z0-9])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
