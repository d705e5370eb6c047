package com.newsdigest.pipeline.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API client.
 *
 * POST {baseUrl}/v1/messages with x-api-key and anthropic-version headers; the summary is the
 * first text block of the response content.
 */
@Slf4j
public class AnthropicSummarizationClient implements SummarizationProvider {

    static final String ANTHROPIC_VERSION = "2023-06-01";

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String language;

    public AnthropicSummarizationClient(WebClient webClient, String apiKey, String model, String language) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.model = model;
        this.language = language;
    }

    @Override
    public ProviderId id() {
        return ProviderId.CLAUDE;
    }

    @Override
    public Mono<String> summarize(String text, int maxOutputLength) {
        Map<String, Object> body = Map.of(
                "model", model,
                "max_tokens", maxOutputLength,
                "system", SummaryPrompts.SYSTEM_MESSAGE,
                "messages", List.of(Map.of("role", "user", "content", SummaryPrompts.build(language, text)))
        );

        log.debug("Calling Claude API with model {}", model);

        return webClient.post()
                .uri("/v1/messages")
                .header("x-api-key", apiKey)
                .header("anthropic-version", ANTHROPIC_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::extractText)
                .onErrorMap(e -> ProviderErrorMapper.map(ProviderId.CLAUDE, e));
    }

    private String extractText(JsonNode response) {
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText("text")) && block.hasNonNull("text")) {
                String text = block.get("text").asText().strip();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        throw ProviderException.invalidResponse(ProviderId.CLAUDE, "no text content (stop_reason="
                + response.path("stop_reason").asText("unknown") + ")");
    }
}
