package com.newsdigest.pipeline.dto;

import com.newsdigest.pipeline.entity.ArticleCategory;
import com.newsdigest.pipeline.entity.SourceType;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Describes where a raw record came from.
 *
 * @param name     display name of the source ("Reuters", "EDINET", ...)
 * @param type     source type, selects the normalizer
 * @param zone     zone for source dates that carry no offset; defaults per source type
 * @param category category configured for the source, used when the type implies none
 */
public record SourceDescriptor(
        String name,
        SourceType type,
        ZoneId zone,
        ArticleCategory category
) {
    public SourceDescriptor {
        if (zone == null) zone = defaultZone(type);
    }

    public static SourceDescriptor of(String name, SourceType type) {
        return new SourceDescriptor(name, type, null, null);
    }

    /**
     * Filings are stamped in Japan time, everything else is assumed UTC.
     */
    private static ZoneId defaultZone(SourceType type) {
        return type == SourceType.FILING ? ZoneId.of("Asia/Tokyo") : ZoneOffset.UTC;
    }
}
