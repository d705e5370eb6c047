package com.newsdigest.pipeline.config;

import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.service.routing.ProviderRoutingTable;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable configuration snapshot for one pipeline run.
 * Built from {@link DigestPipelineProperties#toSettings()} and passed explicitly to every stage.
 */
public record PipelineSettings(
        FilterSettings filter,
        ScoringSettings scoring,
        RoutingSettings routing
) {

    /**
     * @param minTitleLength titles shorter than this are rejected
     * @param minBodyLength  body text shorter than this is rejected
     * @param maxAgeHours    articles older than this (relative to as-of) are rejected
     * @param blockList      case-insensitive title markers that reject an article
     */
    public record FilterSettings(
            int minTitleLength,
            int minBodyLength,
            long maxAgeHours,
            List<String> blockList
    ) {
        public FilterSettings {
            blockList = List.copyOf(blockList);
        }
    }

    /**
     * @param keywords                 terms matched against article text
     * @param pointsPerKeyword         keyword points per matched term
     * @param keywordCap               upper bound of the keyword sub-score
     * @param unknownSourceCredibility credibility (0-100) of sources missing from the table
     * @param credibility              lower-cased source name to credibility (0-100)
     */
    public record ScoringSettings(
            List<String> keywords,
            int pointsPerKeyword,
            int keywordCap,
            int unknownSourceCredibility,
            Map<String, Integer> credibility
    ) {
        public ScoringSettings {
            keywords = List.copyOf(keywords);
            credibility = Map.copyOf(credibility);
        }
    }

    public record RoutingSettings(
            ProviderRoutingTable table,
            Map<ProviderId, Duration> providerTimeouts,
            Duration defaultProviderTimeout,
            int maxConcurrency,
            Duration runTimeout,
            int maxOutputLength,
            DifficultySettings difficulty
    ) {
        public RoutingSettings {
            providerTimeouts = Map.copyOf(providerTimeouts);
        }

        public Duration timeoutFor(ProviderId providerId) {
            return providerTimeouts.getOrDefault(providerId, defaultProviderTimeout);
        }
    }

    /**
     * @param technicalTerms lower-cased academic/technical vocabulary
     * @param mediumDensity  term density (hits per token) at which text counts as MEDIUM
     * @param highDensity    term density at which text counts as HIGH
     */
    public record DifficultySettings(
            Set<String> technicalTerms,
            double mediumDensity,
            double highDensity
    ) {
        public DifficultySettings {
            technicalTerms = Set.copyOf(technicalTerms);
        }
    }
}
