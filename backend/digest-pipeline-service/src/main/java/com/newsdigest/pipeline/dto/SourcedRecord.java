package com.newsdigest.pipeline.dto;

public record SourcedRecord(RawRecord record, SourceDescriptor source) {}
