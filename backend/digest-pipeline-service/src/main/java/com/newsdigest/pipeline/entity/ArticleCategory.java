package com.newsdigest.pipeline.entity;

/**
 * Topic category an article is ranked under.
 * Bound from configuration by name, case-insensitively ("finance", "FINANCE").
 */
public enum ArticleCategory {
    AI,
    FINANCE,
    SCIENCE,
    MANUFACTURING,
    HOBBY,
    UNKNOWN
}
