package com.newsdigest.pipeline.entity;

import java.time.Duration;
import java.time.Instant;

/**
 * One provider call, recorded for cost accounting.
 */
public record ApiUsageRecord(
        ProviderId providerId,
        RoutingTask task,
        int tokenCount,
        Duration latency,
        UsageOutcome outcome,
        Instant timestamp
) {}
