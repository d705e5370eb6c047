package com.newsdigest.pipeline.service.routing;

import com.newsdigest.pipeline.client.ProviderErrorMapper;
import com.newsdigest.pipeline.client.SummarizationProvider;
import com.newsdigest.pipeline.config.PipelineSettings.RoutingSettings;
import com.newsdigest.pipeline.entity.ApiUsageRecord;
import com.newsdigest.pipeline.entity.CanonicalArticle;
import com.newsdigest.pipeline.entity.Difficulty;
import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.entity.RoutingState;
import com.newsdigest.pipeline.entity.RoutingTask;
import com.newsdigest.pipeline.entity.UsageOutcome;
import com.newsdigest.pipeline.exception.ProviderException;
import com.newsdigest.pipeline.exception.RouterExhaustedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Routes articles to summarization providers with ordered fallback.
 *
 * Per article the providers resolved from the routing table are tried strictly one after another,
 * each bounded by its own timeout. The first non-blank summary wins. When every provider fails the
 * cached summary (if any) is served and the article ends EXHAUSTED.
 *
 * Articles are routed in parallel up to maxConcurrency; the whole batch is bounded by runTimeout.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SummarizationRouter {

    private final ProviderRegistry providerRegistry;
    private final SummaryCache summaryCache;
    private final DifficultyClassifier difficultyClassifier;
    private final Clock clock;

    /**
     * Summarize a batch. Outcomes are written to the articles only after every task has finished
     * or the run timeout has cancelled the rest.
     */
    public SummarizationBatchResult summarizeAll(List<CanonicalArticle> articles, RoutingSettings settings) {
        ApiUsageLog usageLog = new ApiUsageLog();
        if (articles.isEmpty()) {
            return new SummarizationBatchResult(List.of(), List.of());
        }

        AtomicReferenceArray<RoutingOutcome> outcomes = new AtomicReferenceArray<>(articles.size());
        articles.forEach(article -> article.setRoutingState(RoutingState.AWAITING_PROVIDER));

        log.info("Summarizing {} articles (maxConcurrency={}, runTimeout={}, providers={})",
                articles.size(), settings.maxConcurrency(), settings.runTimeout(), providerRegistry.available());

        Flux.range(0, articles.size())
                .flatMap(i -> route(articles.get(i), settings, usageLog)
                                .onErrorResume(e -> {
                                    log.error("Routing failed unexpectedly for {}: {}", articles.get(i), e.getMessage(), e);
                                    return Mono.just(RoutingOutcome.exhausted(articles.get(i).getId(), List.of()));
                                })
                                .doOnNext(outcome -> outcomes.set(i, outcome)),
                        settings.maxConcurrency())
                .then()
                .timeout(settings.runTimeout())
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("Summarization run exceeded {}; cancelling in-flight provider calls", settings.runTimeout());
                    return Mono.empty();
                })
                .block();

        List<RoutingOutcome> results = new ArrayList<>(articles.size());
        for (int i = 0; i < articles.size(); i++) {
            CanonicalArticle article = articles.get(i);
            RoutingOutcome outcome = outcomes.get(i);
            if (outcome == null) {
                // unfinished at run timeout: no summary, no cache lookup
                log.warn("{} not summarized before the run timeout", article);
                outcome = RoutingOutcome.exhausted(article.getId(), List.of());
            }
            outcome.applyTo(article);
            results.add(outcome);
        }

        SummarizationBatchResult result = new SummarizationBatchResult(results, usageLog.snapshot());
        log.info("Summarization finished: {} summarized, {} exhausted ({} served from cache), successes by provider {}",
                result.summarizedCount(), result.exhaustedCount(), result.cachedCount(), usageLog.successCounts());
        return result;
    }

    /**
     * Route a single article, recording usage into a throwaway log.
     */
    public Mono<RoutingOutcome> route(CanonicalArticle article, RoutingSettings settings) {
        return route(article, settings, new ApiUsageLog());
    }

    public Mono<RoutingOutcome> route(CanonicalArticle article, RoutingSettings settings, ApiUsageLog usageLog) {
        return Mono.defer(() -> {
            List<ProviderId> chain = selectProviders(article, settings);
            log.debug("Provider chain for {}: {}", article, chain);
            List<ProviderException> failures = Collections.synchronizedList(new ArrayList<>());
            return tryProvidersInSequence(article, article.summarizationText(), chain, 0, settings, usageLog, failures);
        });
    }

    List<ProviderId> selectProviders(CanonicalArticle article, RoutingSettings settings) {
        Difficulty difficulty = null;
        if (settings.table().isDifficultyOverride()) {
            difficulty = difficultyClassifier.classify(article.summarizationText(), settings.difficulty());
            log.debug("Difficulty of {}: {}", article, difficulty);
        }
        return settings.table().resolve(article.getCategory(), RoutingTask.SUMMARIZE, difficulty);
    }

    /**
     * Try providers in sequence until one succeeds
     */
    private Mono<RoutingOutcome> tryProvidersInSequence(CanonicalArticle article,
                                                        String text,
                                                        List<ProviderId> chain,
                                                        int index,
                                                        RoutingSettings settings,
                                                        ApiUsageLog usageLog,
                                                        List<ProviderException> failures) {
        if (index >= chain.size()) {
            return Mono.fromCallable(() -> exhausted(article, failures))
                    .subscribeOn(Schedulers.boundedElastic());
        }

        ProviderId providerId = chain.get(index);
        Optional<SummarizationProvider> provider = providerRegistry.find(providerId);
        if (provider.isEmpty()) {
            log.debug("Provider {} is not enabled, skipping", providerId);
            return tryProvidersInSequence(article, text, chain, index + 1, settings, usageLog, failures);
        }

        Duration timeout = settings.timeoutFor(providerId);
        long startNanos = System.nanoTime();
        log.info("Attempting provider {} for {} (attempt {}/{})", providerId, article, index + 1, chain.size());

        return Mono.defer(() -> provider.get().summarize(text, settings.maxOutputLength()))
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> ProviderException.timeout(providerId, timeout))
                .onErrorMap(e -> ProviderErrorMapper.map(providerId, e))
                .switchIfEmpty(Mono.error(() -> ProviderException.invalidResponse(providerId, "empty response")))
                .flatMap(summary -> summary.isBlank()
                        ? Mono.error(ProviderException.invalidResponse(providerId, "blank summary"))
                        : Mono.just(summary.strip()))
                .flatMap(summary -> {
                    usageLog.append(usage(providerId, text.length() + summary.length(), startNanos, UsageOutcome.SUCCESS));
                    log.info("Provider {} summarized {} ({} chars)", providerId, article, summary.length());
                    return Mono.fromCallable(() -> {
                                summaryCache.store(article.getId(), summary);
                                return RoutingOutcome.summarized(article.getId(), summary, providerId, failures);
                            })
                            .subscribeOn(Schedulers.boundedElastic());
                })
                .onErrorResume(ProviderException.class, e -> {
                    usageLog.append(usage(providerId, text.length(), startNanos, e.getKind().toUsageOutcome()));
                    failures.add(e);
                    log.warn("Provider {} failed for {}: {} ({}). Trying next provider...",
                            providerId, article, e.getMessage(), e.getKind());
                    return tryProvidersInSequence(article, text, chain, index + 1, settings, usageLog, failures);
                });
    }

    private RoutingOutcome exhausted(CanonicalArticle article, List<ProviderException> failures) {
        RouterExhaustedException exhausted = new RouterExhaustedException(article.getId(), failures);
        log.warn("{} ({})", exhausted.getMessage(), article);

        Optional<String> cached = summaryCache.lookup(article.getId());
        if (cached.isPresent()) {
            log.info("Serving cached summary for {}", article);
            return RoutingOutcome.fromCache(article.getId(), cached.get(), failures);
        }
        log.warn("No cached summary for {}; marked for retry", article);
        return RoutingOutcome.exhausted(article.getId(), failures);
    }

    /**
     * Rough token estimate: four characters per token.
     */
    private ApiUsageRecord usage(ProviderId providerId, int chars, long startNanos, UsageOutcome outcome) {
        return new ApiUsageRecord(
                providerId,
                RoutingTask.SUMMARIZE,
                (chars + 3) / 4,
                Duration.ofNanos(System.nanoTime() - startNanos),
                outcome,
                clock.instant());
    }
}
