package com.newsdigest.pipeline.entity;

public enum UsageOutcome {
    SUCCESS,
    ERROR,
    TIMEOUT
}
