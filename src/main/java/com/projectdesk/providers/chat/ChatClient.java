package com.projectdesk.providers.chat;

import com.projectdesk.providers.GenerationEndpoint;

import java.io.IOException;

/**
 * Sends one prompt and returns the reply text. One attempt; retrying is the caller's business.
 */
@FunctionalInterface
public interface ChatClient {

    String complete(GenerationEndpoint endpoint, String apiKey, String prompt) throws IOException, InterruptedException;
}
