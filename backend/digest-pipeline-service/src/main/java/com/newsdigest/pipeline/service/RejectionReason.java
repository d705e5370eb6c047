package com.newsdigest.pipeline.service;

/**
 * Why the filter dropped an article.
 */
public enum RejectionReason {
    TITLE_TOO_SHORT,
    BLOCKED_TITLE,
    BODY_TOO_SHORT,
    TOO_OLD
}
