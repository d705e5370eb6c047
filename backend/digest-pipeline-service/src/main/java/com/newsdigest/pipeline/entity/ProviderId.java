package com.newsdigest.pipeline.entity;

/**
 * Closed set of summarization providers the router may select.
 */
public enum ProviderId {
    CLAUDE("Claude", "https://api.anthropic.com", "claude-sonnet-4-5-20250929", true),
    OPENAI("OpenAI", "https://api.openai.com/v1", "gpt-4o-mini", true),
    OPENROUTER("OpenRouter", "https://openrouter.ai/api/v1", "anthropic/claude-3.5-sonnet", true),
    OLLAMA("Ollama", "http://localhost:11434/v1", "llama3.2", false);

    private final String displayName;
    private final String defaultBaseUrl;
    private final String defaultModel;
    private final boolean requiresApiKey;

    ProviderId(String displayName, String defaultBaseUrl, String defaultModel, boolean requiresApiKey) {
        this.displayName = displayName;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModel = defaultModel;
        this.requiresApiKey = requiresApiKey;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    /**
     * Ollama runs locally without authentication.
     */
    public boolean requiresApiKey() {
        return requiresApiKey;
    }

    /**
     * Whether the provider speaks the OpenAI chat-completions protocol.
     */
    public boolean isOpenAiCompatible() {
        return this != CLAUDE;
    }
}
