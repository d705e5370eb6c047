package com.newsdigest.pipeline.service;

import com.newsdigest.pipeline.config.PipelineSettings.ScoringSettings;
import com.newsdigest.pipeline.entity.CanonicalArticle;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Set;

/**
 * Relevance score in [0, 100], the sum of four sub-scores:
 *
 * <pre>
 * keyword     min(pointsPerKeyword * matched, keywordCap)      0-40
 * recency     &lt;1h 20, &lt;6h 15, &lt;24h 10, older 5                 5-20
 * credibility credibility(source) * 20 / 100                   0-20
 * quality     (min(titleLen / 10, 10) + min(bodyLen / 50, 10)) / 2   0-10
 * </pre>
 *
 * Source credibility is kept on a 0-100 scale (unknown sources get unknownSourceCredibility, 10 by
 * default) and scaled to its 20-point weight, so an unknown source adds 2 points and a 90-credibility
 * wire service 18. Lengths are counted in characters (code points).
 *
 * Pure: the only time reference is the caller's asOf.
 */
@Service
public class RelevanceScorer {

    static final int CREDIBILITY_WEIGHT = 20;

    public int score(CanonicalArticle article, Set<String> matchedKeywords, ScoringSettings settings, OffsetDateTime asOf) {
        double total = keywordScore(matchedKeywords.size(), settings)
                + recencyScore(article.getPublishedAt(), asOf)
                + credibilityOf(article.getSourceName(), settings) * CREDIBILITY_WEIGHT / 100.0
                + qualityScore(article);
        return clamp((int) total);
    }

    /**
     * Credibility of a source on a 0-100 scale, case-insensitive lookup.
     */
    public int credibilityOf(String sourceName, ScoringSettings settings) {
        if (sourceName == null) {
            return settings.unknownSourceCredibility();
        }
        Integer credibility = settings.credibility().get(sourceName.toLowerCase(Locale.ROOT).strip());
        return credibility != null ? clamp(credibility) : settings.unknownSourceCredibility();
    }

    int keywordScore(int matched, ScoringSettings settings) {
        return Math.min(settings.pointsPerKeyword() * matched, settings.keywordCap());
    }

    /**
     * Future dates (clock skew) count as fresh.
     */
    int recencyScore(OffsetDateTime publishedAt, OffsetDateTime asOf) {
        Duration age = Duration.between(publishedAt, asOf);
        if (age.compareTo(Duration.ofHours(1)) < 0) return 20;
        if (age.compareTo(Duration.ofHours(6)) < 0) return 15;
        if (age.compareTo(Duration.ofHours(24)) < 0) return 10;
        return 5;
    }

    double qualityScore(CanonicalArticle article) {
        double title = Math.min(article.titleLength() / 10.0, 10.0);
        double body = Math.min(article.bodyLength() / 50.0, 10.0);
        return (title + body) / 2.0;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
