package com.newsdigest.pipeline.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.pipeline.dto.SourceDescriptor;
import com.newsdigest.pipeline.entity.SourceType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * NewsAPI style article objects.
 *
 * <pre>
 * {"source": {"id": "reuters", "name": "Reuters"}, "author": "...", "title": "...",
 *  "description": "...", "url": "...", "urlToImage": "...", "publishedAt": "2024-05-01T09:00:00Z",
 *  "content": "..."}
 * </pre>
 */
@Component
public class WireNewsNormalizer extends JsonRecordNormalizer {

    public WireNewsNormalizer(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public SourceType supportedType() {
        return SourceType.WIRE_NEWS;
    }

    @Override
    protected ExtractedArticle extract(JsonNode json, SourceDescriptor source) {
        String author = text(json, "author");
        return ExtractedArticle.builder()
                .title(text(json, "title"))
                .url(text(json, "url"))
                .sourceName(text(json.path("source"), "name"))
                .publishedAt(PublishedDateParser.parse(text(json, "publishedAt"), source.zone()).orElse(null))
                .description(text(json, "description"))
                .content(text(json, "content"))
                .imageUrl(text(json, "urlToImage"))
                .authors(author != null ? List.of(author) : List.of())
                .build();
    }
}
