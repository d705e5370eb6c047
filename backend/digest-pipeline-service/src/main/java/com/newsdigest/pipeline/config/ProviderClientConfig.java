package com.newsdigest.pipeline.config;

import com.newsdigest.pipeline.client.AnthropicSummarizationClient;
import com.newsdigest.pipeline.client.OpenAiCompatibleSummarizationClient;
import com.newsdigest.pipeline.client.SummarizationProvider;
import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.service.routing.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builds the enabled summarization providers from {@code digest.providers.*}.
 * Providers that are disabled, or enabled without a required API key, are left out of the registry
 * and skipped by the router.
 */
@Configuration
@Slf4j
public class ProviderClientConfig {

    @Value("${digest.http.user-agent:NewsDigest-Pipeline/1.0}")
    private String userAgent;

    @Bean
    public ProviderRegistry providerRegistry(DigestPipelineProperties properties, ClientHttpConnector providerHttpConnector) {
        Map<ProviderId, SummarizationProvider> providers = new EnumMap<>(ProviderId.class);

        properties.getProviders().forEach((id, settings) -> {
            if (!settings.isEnabled()) {
                return;
            }
            if (id.requiresApiKey() && isBlank(settings.getApiKey())) {
                log.warn("Provider {} is enabled but has no API key configured; skipping", id);
                return;
            }
            providers.put(id, createProvider(id, settings, providerHttpConnector));
        });

        if (providers.isEmpty()) {
            log.warn("No summarization providers are enabled; every article will fall back to the summary cache");
        } else {
            log.info("ProviderRegistry initialized - Available providers: {}", providers.keySet());
        }
        return new ProviderRegistry(providers);
    }

    SummarizationProvider createProvider(ProviderId id, DigestPipelineProperties.Provider settings, ClientHttpConnector connector) {
        String baseUrl = isBlank(settings.getBaseUrl()) ? id.getDefaultBaseUrl() : settings.getBaseUrl();
        String model = isBlank(settings.getModel()) ? id.getDefaultModel() : settings.getModel();

        WebClient webClient = WebClient.builder()
                .clientConnector(connector)
                .baseUrl(baseUrl)
                .defaultHeader("User-Agent", userAgent)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();

        log.debug("Creating {} client: baseUrl={}, model={}", id.getDisplayName(), baseUrl, model);

        if (id == ProviderId.CLAUDE) {
            return new AnthropicSummarizationClient(webClient, settings.getApiKey(), model, settings.getLanguage());
        }
        return new OpenAiCompatibleSummarizationClient(id, webClient, settings.getApiKey(), model, settings.getLanguage());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
