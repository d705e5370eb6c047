package com.newsdigest.pipeline.exception;

/**
 * Raw record could not be converted into a canonical article.
 * The record is skipped; the batch continues.
 */
public class NormalizationException extends DigestPipelineException {

    private final String sourceName;

    public NormalizationException(String message, String sourceName) {
        super("NORMALIZATION_ERROR", message);
        this.sourceName = sourceName;
    }

    public NormalizationException(String message, String sourceName, Throwable cause) {
        super("NORMALIZATION_ERROR", message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    public static NormalizationException missingField(String field, String sourceName) {
        return new NormalizationException("Required field is missing: " + field, sourceName);
    }

    public static NormalizationException unsupportedPayload(Object payload, String sourceName) {
        String type = payload == null ? "null" : payload.getClass().getSimpleName();
        return new NormalizationException("Unsupported raw payload type: " + type, sourceName);
    }

    public static NormalizationException noNormalizer(Object sourceType, String sourceName) {
        return new NormalizationException("No normalizer registered for source type: " + sourceType, sourceName);
    }
}
