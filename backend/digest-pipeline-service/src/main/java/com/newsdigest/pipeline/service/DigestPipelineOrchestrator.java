package com.newsdigest.pipeline.service;

import com.newsdigest.pipeline.config.DigestPipelineProperties;
import com.newsdigest.pipeline.config.PipelineSettings;
import com.newsdigest.pipeline.config.PipelineSettings.ScoringSettings;
import com.newsdigest.pipeline.dto.DigestRunResult;
import com.newsdigest.pipeline.dto.DigestRunStats;
import com.newsdigest.pipeline.dto.SourcedRecord;
import com.newsdigest.pipeline.entity.ArticleCategory;
import com.newsdigest.pipeline.entity.CanonicalArticle;
import com.newsdigest.pipeline.exception.ArticleValidationException;
import com.newsdigest.pipeline.exception.NormalizationException;
import com.newsdigest.pipeline.service.normalize.ArticleNormalizer;
import com.newsdigest.pipeline.service.routing.SummarizationBatchResult;
import com.newsdigest.pipeline.service.routing.SummarizationRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one batch end to end: normalize, filter, score, deduplicate, rank, summarize.
 *
 * A record that fails normalization or validation is logged, counted and skipped. The only
 * batch-level condition is an empty filter result, reported as a warning without calling any
 * provider.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DigestPipelineOrchestrator {

    static final String NO_SURVIVORS_WARNING = "No articles survived filtering";

    private final ArticleNormalizer articleNormalizer;
    private final ArticleFilterService articleFilterService;
    private final KeywordMatcher keywordMatcher;
    private final RelevanceScorer relevanceScorer;
    private final ArticleDeduplicator articleDeduplicator;
    private final ArticleRanker articleRanker;
    private final SummarizationRouter summarizationRouter;
    private final DigestPipelineProperties properties;
    private final Clock clock;

    /**
     * Run with the currently bound configuration, as of now.
     */
    public DigestRunResult run(List<SourcedRecord> records) {
        return run(records, properties.toSettings(), OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC));
    }

    public DigestRunResult run(List<SourcedRecord> records, PipelineSettings settings, OffsetDateTime asOf) {
        long startTime = System.currentTimeMillis();
        log.info("Starting digest run: {} records, asOf={}", records.size(), asOf);

        DigestRunStats.DigestRunStatsBuilder stats = DigestRunStats.builder().received(records.size());

        // 1. normalize
        List<CanonicalArticle> normalized = new ArrayList<>(records.size());
        int normalizationFailures = 0;
        int validationFailures = 0;
        for (SourcedRecord sourced : records) {
            try {
                normalized.add(articleNormalizer.normalize(sourced.record(), sourced.source()));
            } catch (NormalizationException e) {
                normalizationFailures++;
                log.warn("Skipping record from {}: {}", e.getSourceName(), e.getMessage());
            } catch (ArticleValidationException e) {
                validationFailures++;
                log.warn("Skipping invalid article from {}: {}", sourced.source().name(), e.getMessage());
            } catch (RuntimeException e) {
                normalizationFailures++;
                log.error("Unexpected error normalizing record from {}: {}", sourced.source().name(), e.getMessage(), e);
            }
        }
        stats.normalizationFailures(normalizationFailures).validationFailures(validationFailures);

        // 2. filter
        List<CanonicalArticle> survivors = articleFilterService.filter(normalized, settings.filter(), asOf);
        stats.filteredOut(normalized.size() - survivors.size());
        if (survivors.isEmpty()) {
            log.warn("{} ({} normalized, {} records received)", NO_SURVIVORS_WARNING, normalized.size(), records.size());
            return new DigestRunResult(Map.of(), List.of(), stats.build(), Optional.of(NO_SURVIVORS_WARNING));
        }

        // 3. score
        ScoringSettings scoring = settings.scoring();
        for (CanonicalArticle article : survivors) {
            Set<String> matched = keywordMatcher.match(article, scoring.keywords());
            article.setKeywords(matched);
            article.setCredibilityScore(relevanceScorer.credibilityOf(article.getSourceName(), scoring));
            article.setRelevanceScore(relevanceScorer.score(article, matched, scoring, asOf));
        }

        // 4. dedup + rank
        List<CanonicalArticle> unique = articleDeduplicator.deduplicate(survivors);
        stats.duplicatesRemoved(survivors.size() - unique.size());
        Map<ArticleCategory, List<CanonicalArticle>> ranked = articleRanker.rank(unique);
        List<CanonicalArticle> rankedArticles = ranked.values().stream().flatMap(List::stream).toList();
        stats.ranked(rankedArticles.size());

        // 5. summarize
        SummarizationBatchResult summarization = summarizationRouter.summarizeAll(rankedArticles, settings.routing());
        stats.summarized((int) summarization.summarizedCount())
                .exhausted((int) summarization.exhaustedCount())
                .servedFromCache((int) summarization.cachedCount());

        DigestRunStats finalStats = stats.build();
        log.info("Digest run completed in {}ms: {}", System.currentTimeMillis() - startTime, finalStats);
        return new DigestRunResult(ranked, summarization.usageRecords(), finalStats, Optional.empty());
    }
}
