package com.gamemaster.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gamemaster.models.ResolverEndpointConfig;

import java.io.IOException;
import java.net.http.HttpClient;

public class OllamaChatProvider extends AbstractChatProvider {

    public OllamaChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }

    @Override
    public String complete(String apiKey, ResolverEndpointConfig endpoint, String prompt)
        throws IOException, InterruptedException {
        requireModel(endpoint);
        String url = normalizeBaseUrl(endpoint.getBaseUrl(), "http://localhost:11434") + "/api/chat";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.getModel());
        payload.put("stream", false);

        ArrayNode messages = payload.putArray("messages");
        ObjectNode msg = messages.addObject();
        msg.put("role", "user");
        msg.put("content", prompt);

        ObjectNode options = payload.putObject("options");
        options.put("temperature", RESOLUTION_TEMPERATURE);
        options.put("num_predict", endpoint.effectiveMaxOutputTokens());

        JsonNode response = sendJsonPost(url, payload, null, endpoint.effectiveTimeoutMs());

        JsonNode content = response.path("message").path("content");
        if (content.isTextual()) {
            return content.asText();
        }
        JsonNode text = response.path("response");
        if (text.isTextual()) {
            return text.asText();
        }
        throw new IOException("Ollama response had no message content");
    }
}
