package com.newsdigest.pipeline.service.routing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process summary cache, bounded and expiring after write. Default cache type.
 */
public class CaffeineSummaryCache implements SummaryCache {

    private final Cache<String, String> cache;

    public CaffeineSummaryCache(long maximumSize, Duration ttl) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .build();
    }

    @Override
    public Optional<String> lookup(String articleId) {
        return Optional.ofNullable(cache.getIfPresent(articleId));
    }

    @Override
    public void store(String articleId, String summary) {
        cache.put(articleId, summary);
    }
}
