package com.newsdigest.pipeline.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.pipeline.dto.SourceDescriptor;
import com.newsdigest.pipeline.entity.SourceType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * arXiv style preprint metadata.
 *
 * <pre>
 * {"id": "http://arxiv.org/abs/2405.00001v1", "title": "...", "summary": "...",
 *  "published": "2024-05-01T17:59:59Z", "authors": ["A. Author", {"name": "B. Author"}],
 *  "link": "https://arxiv.org/abs/2405.00001"}
 * </pre>
 */
@Component
public class PreprintNormalizer extends JsonRecordNormalizer {

    public PreprintNormalizer(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public SourceType supportedType() {
        return SourceType.PREPRINT;
    }

    @Override
    protected ExtractedArticle extract(JsonNode json, SourceDescriptor source) {
        String link = text(json, "link");
        String summary = text(json, "summary");
        String title = text(json, "title");
        return ExtractedArticle.builder()
                // arXiv wraps long titles over several lines
                .title(title != null ? title.replaceAll("\\s+", " ") : null)
                .url(link != null ? link : text(json, "id"))
                .publishedAt(PublishedDateParser.parse(text(json, "published"), source.zone()).orElse(null))
                .description(summary)
                .content(summary)
                .authors(authorsOf(json.path("authors")))
                .build();
    }

    private List<String> authorsOf(JsonNode authors) {
        List<String> names = new ArrayList<>();
        if (!authors.isArray()) {
            return names;
        }
        for (JsonNode author : authors) {
            String name = author.isTextual() ? author.asText() : author.path("name").asText("");
            if (!name.isBlank()) {
                names.add(name.strip());
            }
        }
        return names;
    }
}
