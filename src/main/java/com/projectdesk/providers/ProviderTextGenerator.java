package com.projectdesk.providers;

import com.projectdesk.AppLogger;
import com.projectdesk.ProjectDeskException;
import com.projectdesk.providers.chat.ChatClient;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TextGenerator} backed by an HTTP chat provider.
 * Each call, retries included, is bounded by a wall-clock timeout; interrupting the caller cancels the request.
 */
public class ProviderTextGenerator implements TextGenerator {

    private final ChatClient client;
    private final GenerationEndpoint endpoint;
    private final String apiKey;
    private final long timeoutMs;
    private final RetryPolicy retryPolicy;
    private final ExecutorService executor;
    private final AppLogger logger = AppLogger.get();

    public ProviderTextGenerator(ChatClient client, GenerationEndpoint endpoint, String apiKey,
                                 long timeoutMs, RetryPolicy retryPolicy) {
        this.client = client;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.timeoutMs = timeoutMs;
        this.retryPolicy = retryPolicy;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "generation-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String generate(String prompt, GenerationContext context) throws InterruptedException {
        long started = System.currentTimeMillis();
        Future<String> future = executor.submit(() -> completeWithRetries(prompt, context));
        try {
            String text = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            logger.info("Generation " + context.purpose() + " for " + context.projectId() + " took "
                + (System.currentTimeMillis() - started) + "ms (" + endpoint.describe() + ")");
            return text;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw ProjectDeskException.generationFailure("Generation timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ProjectDeskException) {
                throw (ProjectDeskException) cause;
            }
            String detail = cause instanceof IOException ? cause.getMessage() : cause.toString();
            throw ProjectDeskException.generationFailure("Generation failed: " + detail, cause);
        }
    }

    private String completeWithRetries(String prompt, GenerationContext context) throws IOException, InterruptedException {
        int attempt = 0;
        while (true) {
            try {
                return client.complete(endpoint, apiKey, prompt);
            } catch (IOException e) {
                attempt++;
                if (attempt > retryPolicy.getMaxRetries() || !retryPolicy.isRetryable(e)) {
                    throw e;
                }
                long delay = retryPolicy.delayMs(attempt);
                logger.warn("Generation " + context.purpose() + " attempt " + attempt + " failed ("
                    + e.getMessage() + "); retrying in " + delay + "ms");
                Thread.sleep(delay);
            }
        }
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
