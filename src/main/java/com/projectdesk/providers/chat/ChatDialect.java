package com.projectdesk.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.projectdesk.providers.GenerationEndpoint;

import java.io.IOException;
import java.net.http.HttpRequest;

/**
 * Wire format of one chat API family: where to post, how to authenticate, what to send and where the reply text is.
 */
public interface ChatDialect {

    String url(GenerationEndpoint endpoint);

    /**
     * Adds credentials. {@code apiKey} may be null for local servers.
     */
    void authorize(HttpRequest.Builder request, String apiKey);

    ObjectNode requestBody(ObjectMapper mapper, GenerationEndpoint endpoint, String prompt);

    /**
     * @throws IOException if the response carries no reply text
     */
    String replyText(JsonNode response) throws IOException;

    static ChatDialect forProvider(String provider) {
        switch (provider) {
            case "anthropic":
                return new AnthropicMessagesDialect();
            case "openai":
                return new OpenAiChatDialect("https://api.openai.com");
            case "ollama":
                return new OpenAiChatDialect("http://localhost:11434");
            default:
                return new OpenAiChatDialect("http://localhost:1234");
        }
    }

    static String baseUrl(GenerationEndpoint endpoint, String fallback) {
        String url = endpoint.baseUrl() == null || endpoint.baseUrl().isBlank() ? fallback : endpoint.baseUrl().trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
