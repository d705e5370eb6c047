package com.newsdigest.pipeline.exception;

import java.util.List;

/**
 * Every provider in an article's fallback list failed.
 * Carries the failed attempts as suppressed exceptions. Logged by the router, never thrown.
 */
public class RouterExhaustedException extends DigestPipelineException {

    public RouterExhaustedException(String articleId, List<ProviderException> failures) {
        super("ROUTER_EXHAUSTED", "All " + failures.size() + " provider attempts failed for article " + articleId);
        failures.forEach(this::addSuppressed);
    }
}
