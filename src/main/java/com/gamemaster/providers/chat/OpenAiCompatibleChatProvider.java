package com.gamemaster.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gamemaster.models.ResolverEndpointConfig;

import java.io.IOException;
import java.net.http.HttpClient;

/**
 * OpenAI-compatible chat provider for {@code openai} and any {@code custom} endpoint.
 * A custom endpoint without a base URL is assumed to be a local server on port 1234.
 */
public class OpenAiCompatibleChatProvider extends AbstractChatProvider {

    private final String providerName;

    public OpenAiCompatibleChatProvider(ObjectMapper mapper, HttpClient httpClient, String providerName) {
        super(mapper, httpClient);
        this.providerName = providerName;
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public String complete(String apiKey, ResolverEndpointConfig endpoint, String prompt)
        throws IOException, InterruptedException {
        requireModel(endpoint);
        String url = normalizeOpenAiBaseUrl(endpoint.getBaseUrl(), defaultOpenAiBase(providerName)) + "/v1/chat/completions";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.getModel());

        ArrayNode messages = payload.putArray("messages");
        ObjectNode msg = messages.addObject();
        msg.put("role", "user");
        msg.put("content", prompt);

        payload.put("temperature", RESOLUTION_TEMPERATURE);
        payload.put("max_tokens", endpoint.effectiveMaxOutputTokens());

        JsonNode response = sendJsonPost(
            url,
            payload,
            apiKey == null || apiKey.isBlank() ? null : "Bearer " + apiKey,
            endpoint.effectiveTimeoutMs()
        );

        JsonNode choices = response.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode choice = choices.get(0);
            JsonNode content = choice.path("message").path("content");
            if (content.isTextual()) {
                return content.asText();
            }
            JsonNode text = choice.path("text");
            if (text.isTextual()) {
                return text.asText();
            }
        }
        throw new IOException("Chat response had no message content");
    }

    private String defaultOpenAiBase(String provider) {
        return "openai".equals(provider) ? "https://api.openai.com" : "http://localhost:1234";
    }

    private String normalizeOpenAiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}
