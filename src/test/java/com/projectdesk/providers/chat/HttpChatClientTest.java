package com.projectdesk.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectdesk.providers.GenerationEndpoint;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HttpChatClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<JsonNode> requests = new CopyOnWriteArrayList<>();
    private final List<String> credentials = new CopyOnWriteArrayList<>();
    private final AtomicInteger overloadedLeft = new AtomicInteger();
    private HttpServer server;
    private HttpChatClient client;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/messages", exchange -> {
            requests.add(mapper.readTree(exchange.getRequestBody()));
            credentials.add(exchange.getRequestHeaders().getFirst("x-api-key"));
            if (overloadedLeft.getAndDecrement() > 0) {
                respond(exchange, 529, "{\"error\":\"overloaded\"}");
                return;
            }
            respond(exchange, 200, "{\"content\":[{\"type\":\"text\",\"text\":\"Hello \"},"
                + "{\"type\":\"tool_use\",\"id\":\"x\"},{\"type\":\"text\",\"text\":\"there\"}]}");
        });
        server.createContext("/v1/chat/completions", exchange -> {
            requests.add(mapper.readTree(exchange.getRequestBody()));
            credentials.add(exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, 200, "{\"choices\":[{\"message\":{\"content\":\"pong\"}}]}");
        });
        server.start();
        client = new HttpChatClient(mapper, Duration.ofSeconds(5));
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private GenerationEndpoint endpoint(String provider, String suffix, int maxOutputTokens) {
        return new GenerationEndpoint(provider, "test-model",
            "http://127.0.0.1:" + server.getAddress().getPort() + suffix, maxOutputTokens, 0);
    }

    @Test
    void anthropicSendsConfiguredTokenCapAndJoinsTextBlocks() throws Exception {
        String reply = client.complete(endpoint("anthropic", "/", 1234), "sk-test", "hi");

        assertEquals("Hello there", reply);
        JsonNode request = requests.get(0);
        assertEquals("test-model", request.get("model").asText());
        assertEquals(1234, request.get("max_tokens").asInt());
        assertEquals("hi", request.get("messages").get(0).get("content").asText());
        assertFalse(request.has("temperature"));
        assertEquals("sk-test", credentials.get(0));
    }

    @Test
    void openAiFormatStripsVersionSuffixAndUsesBearerAuth() throws Exception {
        assertEquals("pong", client.complete(endpoint("lmstudio", "/v1", 64), "key", "ping"));
        assertEquals("Bearer key", credentials.get(0));
        assertEquals(64, requests.get(0).get("max_tokens").asInt());
    }

    @Test
    void nonSuccessStatusCarriesTheCode() {
        overloadedLeft.set(1);
        ChatCallException e = assertThrows(ChatCallException.class,
            () -> client.complete(endpoint("anthropic", "", 10), "sk-test", "hi"));
        assertEquals(529, e.getStatusCode());
        assertTrue(e.getMessage().contains("overloaded"));
        assertEquals(1, requests.size());
    }

    @Test
    void localProvidersSendNoCredentials() throws Exception {
        client.complete(endpoint("ollama", "", 10), null, "ping");
        assertNull(credentials.get(0));
    }

    @Test
    void dialectDefaultsPerProvider() {
        GenerationEndpoint noBase = new GenerationEndpoint("OpenAI", "m", null, 0, 0);
        assertEquals("openai", noBase.provider());
        assertEquals(GenerationEndpoint.DEFAULT_MAX_OUTPUT_TOKENS, noBase.maxOutputTokens());
        assertEquals("https://api.openai.com/v1/chat/completions", ChatDialect.forProvider("openai").url(noBase));
        assertEquals("http://localhost:11434/v1/chat/completions", ChatDialect.forProvider("ollama").url(noBase));
        assertEquals("http://localhost:1234/v1/chat/completions", ChatDialect.forProvider("custom").url(noBase));
        assertEquals("https://api.anthropic.com/v1/messages", ChatDialect.forProvider("anthropic").url(noBase));
    }
}
