package com.projectdesk.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.projectdesk.providers.GenerationEndpoint;

import java.io.IOException;
import java.net.http.HttpRequest;

/**
 * Anthropic Messages API.
 */
public class AnthropicMessagesDialect implements ChatDialect {

    static final String API_VERSION = "2023-06-01";

    @Override
    public String url(GenerationEndpoint endpoint) {
        return ChatDialect.baseUrl(endpoint, "https://api.anthropic.com") + "/v1/messages";
    }

    @Override
    public void authorize(HttpRequest.Builder request, String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("x-api-key", apiKey);
        }
        request.header("anthropic-version", API_VERSION);
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
        // only text blocks carry the answer
        StringBuilder text = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                text.append(block.get("text").asText());
            }
        }
        if (text.length() == 0) {
            throw new IOException("Reply had no text content (stop_reason=" + response.path("stop_reason").asText("?") + ")");
        }
        return text.toString();
    }
}
