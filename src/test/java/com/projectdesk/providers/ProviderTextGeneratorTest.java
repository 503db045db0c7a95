package com.projectdesk.providers;

import com.projectdesk.ErrorKind;
import com.projectdesk.ProjectDeskException;
import com.projectdesk.providers.chat.ChatCallException;
import com.projectdesk.providers.chat.ChatClient;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProviderTextGeneratorTest {

    private static final GenerationEndpoint ENDPOINT = new GenerationEndpoint("anthropic", "m", null, 0, 2);

    private static ProviderTextGenerator generator(ChatClient client, long timeoutMs) {
        return new ProviderTextGenerator(client, ENDPOINT, null, timeoutMs, new RetryPolicy(2, 1, 5));
    }

    @Test
    void returnsProviderReply() throws Exception {
        ProviderTextGenerator generator = generator((endpoint, key, prompt) -> "echo: " + prompt, 5_000);
        try {
            assertEquals("echo: hi", generator.generate("hi", GenerationContext.structured("demo")));
        } finally {
            generator.shutdown();
        }
    }

    @Test
    void retryableFailuresAreRetriedUpToTheLimit() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ProviderTextGenerator recovering = generator((endpoint, key, prompt) -> {
            if (calls.incrementAndGet() < 3) {
                throw new ChatCallException(529, "overloaded");
            }
            return "finally";
        }, 5_000);
        try {
            assertEquals("finally", recovering.generate("hi", GenerationContext.structured("demo")));
            assertEquals(3, calls.get());
        } finally {
            recovering.shutdown();
        }

        AtomicInteger attempts = new AtomicInteger();
        ProviderTextGenerator exhausted = generator((endpoint, key, prompt) -> {
            attempts.incrementAndGet();
            throw new ChatCallException(503, "busy");
        }, 5_000);
        try {
            ProjectDeskException e = assertThrows(ProjectDeskException.class,
                () -> exhausted.generate("hi", GenerationContext.structured("demo")));
            assertEquals(ErrorKind.GENERATION_FAILURE, e.getKind());
            assertEquals(3, attempts.get());
        } finally {
            exhausted.shutdown();
        }
    }

    @Test
    void clientErrorIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        ProviderTextGenerator generator = generator((endpoint, key, prompt) -> {
            attempts.incrementAndGet();
            throw new ChatCallException(401, "bad key");
        }, 5_000);
        try {
            ProjectDeskException e = assertThrows(ProjectDeskException.class,
                () -> generator.generate("hi", GenerationContext.structured("demo")));
            assertEquals(ErrorKind.GENERATION_FAILURE, e.getKind());
            assertTrue(e.getMessage().contains("401"));
            assertEquals(1, attempts.get());
        } finally {
            generator.shutdown();
        }
    }

    @Test
    void timeoutBecomesGenerationFailure() {
        ProviderTextGenerator generator = generator((endpoint, key, prompt) -> {
            Thread.sleep(10_000);
            return "late";
        }, 100);
        try {
            ProjectDeskException e = assertThrows(ProjectDeskException.class,
                () -> generator.generate("hi", GenerationContext.agentTurn("demo", 1)));
            assertEquals(ErrorKind.GENERATION_FAILURE, e.getKind());
            assertTrue(e.getMessage().contains("timed out"));
        } finally {
            generator.shutdown();
        }
    }

    @Test
    void endpointIsPassedToTheClient() throws Exception {
        ProviderTextGenerator generator = generator((endpoint, key, prompt) -> {
            if (endpoint.maxOutputTokens() != GenerationEndpoint.DEFAULT_MAX_OUTPUT_TOKENS) {
                throw new IOException("unexpected endpoint " + endpoint);
            }
            return endpoint.describe();
        }, 5_000);
        try {
            assertEquals("anthropic / m", generator.generate("hi", GenerationContext.structured("demo")));
        } finally {
            generator.shutdown();
        }
    }
}
