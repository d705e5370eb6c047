package com.newsdigest.pipeline.client;

import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.exception.ProviderException;
import reactor.core.publisher.Mono;

/**
 * A text-summarization backend. Treated as opaque: text in, summary out.
 */
public interface SummarizationProvider {

    ProviderId id();

    /**
     * @param text            article text to summarize
     * @param maxOutputLength output token budget
     * @return the summary; errors are signalled as {@link ProviderException}
     */
    Mono<String> summarize(String text, int maxOutputLength);
}
