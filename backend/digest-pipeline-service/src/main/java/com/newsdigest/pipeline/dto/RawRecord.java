package com.newsdigest.pipeline.dto;

import java.time.OffsetDateTime;

/**
 * Source-specific record as handed over by a fetch client.
 *
 * @param payload   JsonNode for API sources, Rome SyndEntry for feeds
 * @param fetchedAt when the fetch client retrieved the record
 */
public record RawRecord(Object payload, OffsetDateTime fetchedAt) {}
