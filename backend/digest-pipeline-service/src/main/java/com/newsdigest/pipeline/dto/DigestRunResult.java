package com.newsdigest.pipeline.dto;

import com.newsdigest.pipeline.entity.ApiUsageRecord;
import com.newsdigest.pipeline.entity.ArticleCategory;
import com.newsdigest.pipeline.entity.CanonicalArticle;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Final output of a run: ranked articles per category, usage records and counters.
 */
public record DigestRunResult(
        Map<ArticleCategory, List<CanonicalArticle>> ranked,
        List<ApiUsageRecord> usageRecords,
        DigestRunStats stats,
        Optional<String> warning
) {
    /**
     * All ranked articles, category by category, for archival.
     */
    public List<CanonicalArticle> articles() {
        return ranked.values().stream().flatMap(List::stream).toList();
    }
}
