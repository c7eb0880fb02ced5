package com.gamemaster.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gamemaster.models.ResolverEndpointConfig;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;

public class GeminiChatProvider extends AbstractChatProvider {

    public GeminiChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public String getProviderName() {
        return "gemini";
    }

    @Override
    public String complete(String apiKey, ResolverEndpointConfig endpoint, String prompt)
        throws IOException, InterruptedException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IOException("API key required for gemini");
        }
        requireModel(endpoint);

        String baseUrl = normalizeGeminiBaseUrl(endpoint.getBaseUrl(), "https://generativelanguage.googleapis.com");
        String url = baseUrl + "/v1beta/models/" + endpoint.getModel() + ":generateContent?key="
            + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);

        ObjectNode payload = mapper.createObjectNode();
        ArrayNode contents = payload.putArray("contents");
        ObjectNode content = contents.addObject();
        content.put("role", "user");
        ArrayNode parts = content.putArray("parts");
        parts.addObject().put("text", prompt);

        ObjectNode generationConfig = payload.putObject("generationConfig");
        generationConfig.put("temperature", RESOLUTION_TEMPERATURE);
        generationConfig.put("maxOutputTokens", endpoint.effectiveMaxOutputTokens());
        // 2.5 models spend thinking tokens out of maxOutputTokens; a bare choice id needs none.
        generationConfig.putObject("thinkingConfig").put("thinkingBudget", 0);

        JsonNode response = sendJsonPost(url, payload, null, endpoint.effectiveTimeoutMs());

        JsonNode candidates = response.path("candidates");
        if (candidates.isArray() && candidates.size() > 0) {
            JsonNode partsNode = candidates.get(0).path("content").path("parts");
            if (partsNode.isArray() && partsNode.size() > 0) {
                return partsNode.get(0).path("text").asText();
            }
        }
        throw new IOException("Gemini response had no text part");
    }

    private String normalizeGeminiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1beta/models")) {
            url = url.substring(0, url.length() - 14);
        }
        if (url.endsWith("/v1beta")) {
            url = url.substring(0, url.length() - 7);
        }
        return url;
    }
}
