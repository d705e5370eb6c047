package com.newsdigest.pipeline.exception;

import com.newsdigest.pipeline.entity.UsageOutcome;

public enum ProviderErrorKind {
    TIMEOUT,
    RATE_LIMITED,
    INVALID_RESPONSE,
    TRANSPORT;

    public UsageOutcome toUsageOutcome() {
        return this == TIMEOUT ? UsageOutcome.TIMEOUT : UsageOutcome.ERROR;
    }
}
