package com.newsdigest.pipeline.exception;

/**
 * Canonical article invariant violated at construction or mutation.
 */
public class ArticleValidationException extends DigestPipelineException {

    public ArticleValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }

    public static ArticleValidationException blank(String field) {
        return new ArticleValidationException(field + " is required");
    }

    public static ArticleValidationException scoreOutOfRange(String field, int value) {
        return new ArticleValidationException(field + " must be within 0-100 (was " + value + ")");
    }
}
