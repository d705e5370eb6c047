package com.newsdigest.pipeline.service.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.pipeline.dto.RawRecord;
import com.newsdigest.pipeline.dto.SourceDescriptor;
import com.newsdigest.pipeline.exception.NormalizationException;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * Base for sources that deliver JSON objects. Accepts a {@link JsonNode}, a JSON string or a
 * {@link Map} as payload.
 */
@RequiredArgsConstructor
public abstract class JsonRecordNormalizer implements RecordNormalizer {

    protected final ObjectMapper objectMapper;

    @Override
    public final ExtractedArticle extract(RawRecord record, SourceDescriptor source) {
        return extract(toJson(record.payload(), source.name()), source);
    }

    protected abstract ExtractedArticle extract(JsonNode json, SourceDescriptor source);

    private JsonNode toJson(Object payload, String sourceName) {
        JsonNode node;
        if (payload instanceof JsonNode json) {
            node = json;
        } else if (payload instanceof String text) {
            try {
                node = objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                throw new NormalizationException("Payload is not valid JSON: " + e.getOriginalMessage(), sourceName, e);
            }
        } else if (payload instanceof Map<?, ?> map) {
            try {
                node = objectMapper.valueToTree(map);
            } catch (IllegalArgumentException e) {
                throw new NormalizationException("Payload map is not convertible to JSON: " + e.getMessage(), sourceName, e);
            }
        } else {
            throw NormalizationException.unsupportedPayload(payload, sourceName);
        }
        if (node == null || !node.isObject()) {
            throw NormalizationException.unsupportedPayload(payload, sourceName);
        }
        return node;
    }

    /**
     * Text value of a field, null when missing, JSON null or blank.
     */
    protected static String text(JsonNode json, String field) {
        JsonNode value = json.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.strip();
    }
}
