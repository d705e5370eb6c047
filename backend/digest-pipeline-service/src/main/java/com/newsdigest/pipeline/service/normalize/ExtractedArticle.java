package com.newsdigest.pipeline.service.normalize;

import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Fields pulled out of one source-specific record, before the shared normalization rules apply.
 *
 * @param sourceName  source name carried by the record itself, null to use the descriptor's
 * @param publishedAt parsed publish date, null when missing or unparseable
 */
@Builder
public record ExtractedArticle(
        String title,
        String url,
        String sourceName,
        OffsetDateTime publishedAt,
        String description,
        String content,
        String imageUrl,
        List<String> authors
) {}
