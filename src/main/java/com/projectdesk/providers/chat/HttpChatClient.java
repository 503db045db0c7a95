package com.projectdesk.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectdesk.providers.GenerationEndpoint;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link ChatClient} over {@link HttpClient}, picking the {@link ChatDialect} from the endpoint's provider.
 */
public class HttpChatClient implements ChatClient {

    private final ObjectMapper mapper;
    private final HttpClient http;
    private final Duration requestTimeout;

    public HttpChatClient(ObjectMapper mapper, Duration requestTimeout) {
        this.mapper = mapper;
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public String complete(GenerationEndpoint endpoint, String apiKey, String prompt)
        throws IOException, InterruptedException {
        ChatDialect dialect = ChatDialect.forProvider(endpoint.provider());
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(dialect.url(endpoint)))
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(
                mapper.writeValueAsString(dialect.requestBody(mapper, endpoint, prompt))));
        dialect.authorize(request, apiKey);

        HttpResponse<String> response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new ChatCallException(response.statusCode(), response.body());
        }
        JsonNode body = mapper.readTree(response.body());
        return dialect.replyText(body);
    }
}
