package com.newsdigest.pipeline.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.pipeline.dto.SourceDescriptor;
import com.newsdigest.pipeline.entity.SourceType;
import com.newsdigest.pipeline.exception.NormalizationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * EDINET document list entries.
 *
 * <pre>
 * {"docID": "S100ABCD", "filerName": "トヨタ自動車株式会社",
 *  "docDescription": "有価証券報告書－第120期(...)", "submitDateTime": "2024-06-18 15:00"}
 * </pre>
 *
 * The title is "filerName docDescription"; submitDateTime carries no offset and is read in the
 * descriptor zone.
 */
@Component
public class FilingNormalizer extends JsonRecordNormalizer {

    private final String documentUrlTemplate;

    public FilingNormalizer(ObjectMapper objectMapper,
                            @Value("${digest.normalize.filing-document-url:https://disclosure2.edinet-fsa.go.jp/WZEK0040.aspx?%s}")
                            String documentUrlTemplate) {
        super(objectMapper);
        this.documentUrlTemplate = documentUrlTemplate;
    }

    @Override
    public SourceType supportedType() {
        return SourceType.FILING;
    }

    @Override
    protected ExtractedArticle extract(JsonNode json, SourceDescriptor source) {
        String docId = text(json, "docID");
        if (docId == null) {
            throw NormalizationException.missingField("docID", source.name());
        }
        String filer = text(json, "filerName");
        String description = text(json, "docDescription");
        String title = filer == null ? description
                : description == null ? filer
                : filer + " " + description;

        return ExtractedArticle.builder()
                .title(title)
                .url(String.format(documentUrlTemplate, docId))
                .publishedAt(PublishedDateParser.parse(text(json, "submitDateTime"), source.zone()).orElse(null))
                .description(description)
                .authors(filer != null ? List.of(filer) : List.of())
                .build();
    }
}
