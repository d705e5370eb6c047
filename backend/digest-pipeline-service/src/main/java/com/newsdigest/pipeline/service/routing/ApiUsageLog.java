package com.newsdigest.pipeline.service.routing;

import com.newsdigest.pipeline.entity.ApiUsageRecord;
import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.entity.UsageOutcome;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * Append-only usage log for one batch. Safe for concurrent appends from routing tasks.
 */
public class ApiUsageLog {

    private final Queue<ApiUsageRecord> records = new ConcurrentLinkedQueue<>();

    public void append(ApiUsageRecord record) {
        records.add(record);
    }

    public List<ApiUsageRecord> snapshot() {
        return List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    /**
     * Successful calls per provider, for the end-of-run summary line.
     */
    public Map<ProviderId, Long> successCounts() {
        return records.stream()
                .filter(r -> r.outcome() == UsageOutcome.SUCCESS)
                .collect(Collectors.groupingBy(ApiUsageRecord::providerId, Collectors.counting()));
    }
}
