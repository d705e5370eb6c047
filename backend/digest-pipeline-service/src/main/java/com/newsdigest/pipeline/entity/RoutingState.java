package com.newsdigest.pipeline.entity;

/**
 * Per-article summarization state: PENDING, AWAITING_PROVIDER, then SUMMARIZED or EXHAUSTED.
 */
public enum RoutingState {
    PENDING,
    AWAITING_PROVIDER,
    SUMMARIZED,
    EXHAUSTED
}
