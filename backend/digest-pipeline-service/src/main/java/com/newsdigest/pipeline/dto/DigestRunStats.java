package com.newsdigest.pipeline.dto;

import lombok.Builder;

/**
 * Per-stage counters for one pipeline run.
 */
@Builder
public record DigestRunStats(
        int received,
        int normalizationFailures,
        int validationFailures,
        int filteredOut,
        int duplicatesRemoved,
        int ranked,
        int summarized,
        int exhausted,
        int servedFromCache
) {}
