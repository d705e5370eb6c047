package com.newsdigest.pipeline.service.routing;

import com.newsdigest.pipeline.config.PipelineSettings.DifficultySettings;
import com.newsdigest.pipeline.entity.Difficulty;
import com.newsdigest.pipeline.util.LanguageDetector;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Classifies text difficulty by technical-term density (hits per token).
 *
 * Latin text is tokenized on whitespace and punctuation. Each Japanese character counts as one
 * token and Japanese terms are counted by occurrence.
 */
@Component
public class DifficultyClassifier {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\p{Punct}、。「」（）・]+");

    public Difficulty classify(String text, DifficultySettings settings) {
        double density = density(text, settings);
        if (density >= settings.highDensity()) return Difficulty.HIGH;
        if (density >= settings.mediumDensity()) return Difficulty.MEDIUM;
        return Difficulty.LOW;
    }

    double density(String text, DifficultySettings settings) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int tokens = 0;
        int hits = 0;

        for (String token : SEPARATORS.split(lower)) {
            if (token.isEmpty()) continue;
            int japanese = (int) token.codePoints().filter(LanguageDetector::isJapanese).count();
            // mixed tokens: Japanese characters individually, Latin remainder as one
            tokens += japanese + (japanese < token.codePointCount(0, token.length()) ? 1 : 0);
            if (japanese == 0 && settings.technicalTerms().contains(token)) {
                hits++;
            }
        }
        for (String term : settings.technicalTerms()) {
            if (LanguageDetector.containsJapanese(term)) {
                hits += occurrences(lower, term);
            }
        }
        return tokens == 0 ? 0.0 : (double) hits / tokens;
    }

    private static int occurrences(String text, String term) {
        int count = 0;
        for (int i = text.indexOf(term); i >= 0; i = text.indexOf(term, i + term.length())) {
            count++;
        }
        return count;
    }
}
