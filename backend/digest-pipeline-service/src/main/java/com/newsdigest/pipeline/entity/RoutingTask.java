package com.newsdigest.pipeline.entity;

/**
 * Tasks a provider can be routed for. Only summarization exists today.
 */
public enum RoutingTask {
    SUMMARIZE
}
