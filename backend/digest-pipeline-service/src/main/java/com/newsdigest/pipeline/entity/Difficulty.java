package com.newsdigest.pipeline.entity;

/**
 * Reading difficulty of an article's text, used by the optional provider-tier override.
 */
public enum Difficulty {
    LOW,
    MEDIUM,
    HIGH
}
