package com.projectdesk.providers;

import com.projectdesk.providers.chat.ChatCallException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * When a failed generation call is tried again, and how long to wait first.
 * Delays double per attempt from {@code baseDelayMs} up to {@code maxDelayMs}, with up to 20% jitter.
 */
public class RetryPolicy {

    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public RetryPolicy(int maxRetries, long baseDelayMs, long maxDelayMs) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public static RetryPolicy forEndpoint(GenerationEndpoint endpoint) {
        return new RetryPolicy(endpoint.maxRetries(), 400, 8_000);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Throttling, server errors and dropped connections are retried.
     * Refused connections and other client errors are not: the next attempt would fail the same way.
     */
    public boolean isRetryable(IOException failure) {
        if (failure instanceof ChatCallException) {
            int status = ((ChatCallException) failure).getStatusCode();
            return status == 408 || status == 429 || status >= 500;
        }
        if (failure instanceof HttpTimeoutException) {
            return true;
        }
        return !(failure instanceof ConnectException);
    }

    /**
     * Wait before retry number {@code attempt} (1-based).
     */
    public long delayMs(int attempt) {
        long delay = baseDelayMs << Math.min(Math.max(attempt - 1, 0), 16);
        delay = Math.min(delay, maxDelayMs);
        long jitter = delay <= 0 ? 0 : ThreadLocalRandom.current().nextLong(delay / 5 + 1);
        return Math.min(maxDelayMs, delay + jitter);
    }
}
