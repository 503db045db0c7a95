package com.projectdesk.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.projectdesk.providers.GenerationEndpoint;

import java.io.IOException;
import java.net.http.HttpRequest;

/**
 * OpenAI chat completions, also spoken by Ollama, LM Studio and most self-hosted servers.
 */
public class OpenAiChatDialect implements ChatDialect {

    private final String defaultBaseUrl;

    public OpenAiChatDialect(String defaultBaseUrl) {
        this.defaultBaseUrl = defaultBaseUrl;
    }

    @Override
    public String url(GenerationEndpoint endpoint) {
        String base = ChatDialect.baseUrl(endpoint, defaultBaseUrl);
        if (base.endsWith("/v1")) {
            base = base.substring(0, base.length() - 3);
        }
        return base + "/v1/chat/completions";
    }

    @Override
    public void authorize(HttpRequest.Builder request, String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }
    }

    @Override
    public ObjectNode requestBody(ObjectMapper mapper, GenerationEndpoint endpoint, String prompt) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", endpoint.model());
        body.put("max_tokens", endpoint.maxOutputTokens());
        body.putArray("messages").addObject()
            .put("role", "user")
            .put("content", prompt);
        return body;
    }

    @Override
    public String replyText(JsonNode response) throws IOException {
        JsonNode choice = response.path("choices").path(0);
        JsonNode content = choice.path("message").path("content");
        if (content.isTextual()) {
            return content.asText();
        }
        // legacy completions shape
        if (choice.path("text").isTextual()) {
            return choice.path("text").asText();
        }
        throw new IOException("Reply had no choices");
    }
}
