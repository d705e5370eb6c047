package com.newsdigest.pipeline.service.routing;

import com.newsdigest.pipeline.entity.ApiUsageRecord;
import com.newsdigest.pipeline.entity.RoutingState;

import java.util.List;

/**
 * Outcomes in article order plus every provider call made for the batch.
 */
public record SummarizationBatchResult(
        List<RoutingOutcome> outcomes,
        List<ApiUsageRecord> usageRecords
) {
    public long summarizedCount() {
        return outcomes.stream().filter(o -> o.state() == RoutingState.SUMMARIZED).count();
    }

    public long exhaustedCount() {
        return outcomes.stream().filter(o -> o.state() == RoutingState.EXHAUSTED).count();
    }

    public long cachedCount() {
        return outcomes.stream().filter(RoutingOutcome::cached).count();
    }
}
