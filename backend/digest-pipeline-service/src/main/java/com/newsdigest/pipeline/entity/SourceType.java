package com.newsdigest.pipeline.entity;

/**
 * Kinds of upstream sources a raw record can come from.
 *
 * - WIRE_NEWS: news API articles (NewsAPI and similar)
 * - FEED: RSS/Atom entries (Rome)
 * - FILING: regulatory filings (EDINET and similar)
 * - PREPRINT: preprint metadata (arXiv and similar)
 */
public enum SourceType {
    WIRE_NEWS,
    FEED,
    FILING,
    PREPRINT;

    /**
     * Category implied by the source type alone, if any.
     */
    public ArticleCategory impliedCategory() {
        return switch (this) {
            case FILING -> ArticleCategory.FINANCE;
            case PREPRINT -> ArticleCategory.SCIENCE;
            default -> null;
        };
    }
}
