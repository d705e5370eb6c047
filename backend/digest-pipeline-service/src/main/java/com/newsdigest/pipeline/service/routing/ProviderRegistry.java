package com.newsdigest.pipeline.service.routing;

import com.newsdigest.pipeline.client.SummarizationProvider;
import com.newsdigest.pipeline.entity.ProviderId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Enabled summarization providers by id.
 */
public class ProviderRegistry {

    private final Map<ProviderId, SummarizationProvider> providers;

    public ProviderRegistry(Map<ProviderId, SummarizationProvider> providers) {
        Map<ProviderId, SummarizationProvider> copy = new EnumMap<>(ProviderId.class);
        copy.putAll(providers);
        this.providers = Collections.unmodifiableMap(copy);
    }

    public Optional<SummarizationProvider> find(ProviderId providerId) {
        return Optional.ofNullable(providers.get(providerId));
    }

    public Set<ProviderId> available() {
        return providers.keySet();
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }
}
