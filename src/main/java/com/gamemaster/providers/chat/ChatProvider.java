package com.gamemaster.providers.chat;

import com.gamemaster.models.ResolverEndpointConfig;

import java.io.IOException;

/**
 * Interface for language-model chat providers.
 * Each provider implementation handles the specific API format for that service.
 */
public interface ChatProvider {

    /**
     * Get the provider name this implementation handles.
     */
    String getProviderName();

    /**
     * Send a single-turn prompt with deterministic decoding and return the reply text.
     *
     * @param apiKey The API key (may be null for local providers)
     * @param endpoint Model, base URL, timeout and output budget
     * @param prompt The user message to send
     * @return The assistant's reply text
     * @throws IOException on transport failure or a non-2xx status
     */
    String complete(String apiKey, ResolverEndpointConfig endpoint, String prompt)
        throws IOException, InterruptedException;
}
