package com.newsdigest.pipeline.service.routing;

import java.util.Optional;

/**
 * Last known good summary per article id. Consulted only when every provider failed.
 * Implementations must be thread-safe.
 */
public interface SummaryCache {

    Optional<String> lookup(String articleId);

    void store(String articleId, String summary);
}
