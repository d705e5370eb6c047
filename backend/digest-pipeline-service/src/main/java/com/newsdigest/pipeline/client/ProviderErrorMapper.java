package com.newsdigest.pipeline.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.exception.ProviderErrorKind;
import com.newsdigest.pipeline.exception.ProviderException;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Translates client-side failures into {@link ProviderException}s.
 *
 * <pre>
 * HTTP 429                       RATE_LIMITED
 * Reactor/Netty timeouts         TIMEOUT
 * undecodable or empty payload   INVALID_RESPONSE
 * anything else                  TRANSPORT
 * </pre>
 */
public final class ProviderErrorMapper {

    private ProviderErrorMapper() {
    }

    public static ProviderException map(ProviderId providerId, Throwable error) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        if (error instanceof WebClientResponseException response
                && response.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return ProviderException.rateLimited(providerId, response.getStatusText());
        }
        if (isTimeout(error)) {
            return new ProviderException(providerId, ProviderErrorKind.TIMEOUT,
                    providerId + " timed out: " + error.getMessage(), error);
        }
        if (error instanceof DecodingException || error instanceof JsonProcessingException) {
            return new ProviderException(providerId, ProviderErrorKind.INVALID_RESPONSE,
                    providerId + " returned an undecodable response: " + error.getMessage(), error);
        }
        return ProviderException.transport(providerId, error);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof ReadTimeoutException || t instanceof WriteTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
