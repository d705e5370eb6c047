package com.newsdigest.pipeline.service.routing;

import com.newsdigest.pipeline.entity.CanonicalArticle;
import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.entity.RoutingState;
import com.newsdigest.pipeline.exception.ProviderException;

import java.util.List;

/**
 * Result of routing one article. Computed concurrently, applied to the article afterwards.
 *
 * @param provider provider that produced the summary, null when exhausted
 * @param cached   summary came from the cache after every provider failed
 * @param failures failed attempts in the order they were made
 */
public record RoutingOutcome(
        String articleId,
        RoutingState state,
        String summary,
        ProviderId provider,
        boolean cached,
        List<ProviderException> failures
) {
    public RoutingOutcome {
        failures = List.copyOf(failures);
    }

    public static RoutingOutcome summarized(String articleId, String summary, ProviderId provider,
                                            List<ProviderException> failures) {
        return new RoutingOutcome(articleId, RoutingState.SUMMARIZED, summary, provider, false, failures);
    }

    public static RoutingOutcome fromCache(String articleId, String summary, List<ProviderException> failures) {
        return new RoutingOutcome(articleId, RoutingState.EXHAUSTED, summary, null, true, failures);
    }

    public static RoutingOutcome exhausted(String articleId, List<ProviderException> failures) {
        return new RoutingOutcome(articleId, RoutingState.EXHAUSTED, null, null, false, failures);
    }

    public void applyTo(CanonicalArticle article) {
        article.setRoutingState(state);
        article.setSummary(summary);
        article.setSummaryProvider(provider);
        article.setCached(cached);
    }
}
