package com.newsdigest.pipeline.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions client.
 * Serves OpenAI, OpenRouter and Ollama, which differ only in base URL, key and model.
 */
@Slf4j
public class OpenAiCompatibleSummarizationClient implements SummarizationProvider {

    private final ProviderId providerId;
    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String language;

    public OpenAiCompatibleSummarizationClient(ProviderId providerId, WebClient webClient,
                                               String apiKey, String model, String language) {
        if (!providerId.isOpenAiCompatible()) {
            throw new IllegalArgumentException(providerId + " does not speak the chat-completions protocol");
        }
        this.providerId = providerId;
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.model = model;
        this.language = language;
    }

    @Override
    public ProviderId id() {
        return providerId;
    }

    @Override
    public Mono<String> summarize(String text, int maxOutputLength) {
        Map<String, Object> body = Map.of(
                "model", model,
                "max_tokens", maxOutputLength,
                "stream", false,
                "messages", List.of(
                        Map.of("role", "system", "content", SummaryPrompts.SYSTEM_MESSAGE),
                        Map.of("role", "user", "content", SummaryPrompts.build(language, text))
                )
        );

        log.debug("Calling {} API with model {}", providerId.getDisplayName(), model);

        WebClient.RequestBodySpec request = webClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON);

        if (apiKey != null && !apiKey.isBlank()) {
            request = request.header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }

        return request
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::extractContent)
                .onErrorMap(e -> ProviderErrorMapper.map(providerId, e));
    }

    private String extractContent(JsonNode response) {
        JsonNode choices = response.path("choices");
        if (choices.isArray() && !choices.isEmpty()) {
            String content = choices.get(0).path("message").path("content").asText("").strip();
            if (!content.isEmpty()) {
                return content;
            }
        }
        throw ProviderException.invalidResponse(providerId, "no message content in choices");
    }
}
