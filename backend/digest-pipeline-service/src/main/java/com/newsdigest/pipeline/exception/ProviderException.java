package com.newsdigest.pipeline.exception;

import com.newsdigest.pipeline.entity.ProviderId;

import java.time.Duration;

/**
 * A single provider attempt failed. Triggers fallback to the next provider.
 */
public class ProviderException extends DigestPipelineException {

    private final ProviderId providerId;
    private final ProviderErrorKind kind;

    public ProviderException(ProviderId providerId, ProviderErrorKind kind, String message) {
        super("PROVIDER_ERROR", message);
        this.providerId = providerId;
        this.kind = kind;
    }

    public ProviderException(ProviderId providerId, ProviderErrorKind kind, String message, Throwable cause) {
        super("PROVIDER_ERROR", message, cause);
        this.providerId = providerId;
        this.kind = kind;
    }

    public ProviderId getProviderId() {
        return providerId;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }

    public static ProviderException timeout(ProviderId providerId, Duration timeout) {
        return new ProviderException(providerId, ProviderErrorKind.TIMEOUT,
                providerId + " did not respond within " + timeout.toMillis() + "ms");
    }

    public static ProviderException rateLimited(ProviderId providerId, String detail) {
        return new ProviderException(providerId, ProviderErrorKind.RATE_LIMITED,
                providerId + " rate limited: " + detail);
    }

    public static ProviderException invalidResponse(ProviderId providerId, String detail) {
        return new ProviderException(providerId, ProviderErrorKind.INVALID_RESPONSE,
                providerId + " returned an invalid response: " + detail);
    }

    public static ProviderException transport(ProviderId providerId, Throwable cause) {
        return new ProviderException(providerId, ProviderErrorKind.TRANSPORT,
                providerId + " call failed: " + cause.getMessage(), cause);
    }
}
