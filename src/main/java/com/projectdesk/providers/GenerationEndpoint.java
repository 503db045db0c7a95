package com.projectdesk.providers;

import java.util.Locale;

/**
 * Where generation requests go and how large a reply may be.
 *
 * @param provider        anthropic, openai, ollama, lmstudio or custom; unknown names speak the OpenAI format
 * @param baseUrl         null or blank selects the provider's default
 * @param maxOutputTokens cap on reply tokens sent with every request
 * @param maxRetries      extra attempts after a retryable failure
 */
public record GenerationEndpoint(String provider, String model, String baseUrl, int maxOutputTokens, int maxRetries) {

    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 4096;
    public static final int DEFAULT_MAX_RETRIES = 2;

    public GenerationEndpoint {
        if (provider == null || provider.isBlank()) {
            provider = "custom";
        }
        provider = provider.trim().toLowerCase(Locale.ROOT);
        if (maxOutputTokens <= 0) {
            maxOutputTokens = DEFAULT_MAX_OUTPUT_TOKENS;
        }
        maxRetries = Math.max(0, maxRetries);
    }

    public String describe() {
        return provider + " / " + model;
    }
}
