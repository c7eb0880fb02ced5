package com.gamemaster.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamemaster.models.ResolverEndpointConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Abstract base class for chat providers with shared HTTP logic.
 */
public abstract class AbstractChatProvider implements ChatProvider {

    /**
     * Resolution must be reproducible, so every provider decodes greedily.
     */
    protected static final double RESOLUTION_TEMPERATURE = 0.0;

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;

    protected AbstractChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    /**
     * Send a JSON POST request and return the parsed response. One attempt only.
     */
    protected JsonNode sendJsonPost(String url, JsonNode payload, String bearerAuth, int timeoutMs)
        throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(Duration.ofMillis(timeoutMs))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));

        if (bearerAuth != null && !bearerAuth.isBlank()) {
            builder.header("Authorization", bearerAuth);
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Chat request failed (" + status + "): " + abbreviate(response.body(), 300));
        }
        return mapper.readTree(response.body());
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    protected void requireModel(ResolverEndpointConfig endpoint) throws IOException {
        if (endpoint == null || endpoint.getModel() == null || endpoint.getModel().isBlank()) {
            throw new IOException("Model is required for " + getProviderName());
        }
    }

    private String abbreviate(String body, int max) {
        if (body == null) {
            return "";
        }
        return body.length() <= max ? body : body.substring(0, max) + "...";
    }
}
