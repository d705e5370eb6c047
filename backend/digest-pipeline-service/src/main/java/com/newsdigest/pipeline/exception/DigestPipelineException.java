package com.newsdigest.pipeline.exception;

/**
 * Base class of all pipeline exceptions. The error code identifies the failure kind in logs.
 */
public class DigestPipelineException extends RuntimeException {

    private final String errorCode;

    public DigestPipelineException(String message) {
        super(message);
        this.errorCode = "PIPELINE_ERROR";
    }

    public DigestPipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DigestPipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
