package com.gamemaster.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamemaster.models.ResolverEndpointConfig;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ChatProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ChatProviderFactory factory = new ChatProviderFactory(mapper);
    private final AtomicReference<JsonNode> received = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicReference<String> path = new AtomicReference<>();
    private Javalin server;

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    private String startServer(int status, String body) {
        server = Javalin.create().post("/*", ctx -> {
            path.set(ctx.path());
            authorization.set(ctx.header("Authorization"));
            received.set(mapper.readTree(ctx.body()));
            ctx.status(status).result(body);
        }).start(0);
        return "http://localhost:" + server.port();
    }

    private ResolverEndpointConfig endpoint(String provider, String baseUrl) {
        return new ResolverEndpointConfig(provider, "test-model", baseUrl, 2000);
    }

    @Test
    void factoryMapsProviderNames() {
        assertTrue(factory.getProvider("gemini") instanceof GeminiChatProvider);
        assertTrue(factory.getProvider("OLLAMA") instanceof OllamaChatProvider);
        assertTrue(factory.getProvider("openai") instanceof OpenAiCompatibleChatProvider);
        assertEquals("custom", factory.getProvider(null).getProviderName());
        assertTrue(factory.getProvider("custom") instanceof OpenAiCompatibleChatProvider);
        assertSame(factory.getProvider("openai"), factory.getProvider("openai"));
    }

    @Test
    void openAiCompatibleSendsDeterministicRequest() throws Exception {
        String base = startServer(200, "{\"choices\":[{\"message\":{\"content\":\"descend\"}}]}");
        ChatProvider provider = factory.getProvider("custom");

        String reply = provider.complete("secret", endpoint("custom", base + "/v1/"), "pick one");

        assertEquals("descend", reply);
        assertEquals("/v1/chat/completions", path.get());
        assertEquals("Bearer secret", authorization.get());
        assertEquals("test-model", received.get().path("model").asText());
        assertEquals(0.0, received.get().path("temperature").asDouble());
        assertEquals(ResolverEndpointConfig.DEFAULT_MAX_OUTPUT_TOKENS, received.get().path("max_tokens").asInt());
        assertEquals("pick one", received.get().path("messages").get(0).path("content").asText());
    }

    @Test
    void openAiCompatibleOmitsAuthWithoutKey() throws Exception {
        String base = startServer(200, "{\"choices\":[{\"text\":\"NONE\"}]}");

        String reply = factory.getProvider("openai").complete(null, endpoint("openai", base), "pick one");

        assertEquals("NONE", reply);
        assertNull(authorization.get());
    }

    @Test
    void errorStatusFailsWithoutRetry() {
        String base = startServer(503, "overloaded");
        ChatProvider provider = factory.getProvider("custom");

        IOException e = assertThrows(IOException.class,
            () -> provider.complete(null, endpoint("custom", base), "pick one"));
        assertTrue(e.getMessage().contains("503"));
    }

    @Test
    void emptyResponseIsAnError() {
        String base = startServer(200, "{\"choices\":[]}");
        assertThrows(IOException.class,
            () -> factory.getProvider("custom").complete(null, endpoint("custom", base), "pick one"));
    }

    @Test
    void geminiSendsGenerationConfig() throws Exception {
        String base = startServer(200, "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"fight\"}]}}]}");

        String reply = factory.getProvider("gemini").complete("k", endpoint("gemini", base), "pick one");

        assertEquals("fight", reply);
        assertEquals("/v1beta/models/test-model:generateContent", path.get());
        JsonNode config = received.get().path("generationConfig");
        assertEquals(0.0, config.path("temperature").asDouble());
        assertEquals(ResolverEndpointConfig.DEFAULT_MAX_OUTPUT_TOKENS, config.path("maxOutputTokens").asInt());
        assertEquals("pick one", received.get().path("contents").get(0).path("parts").get(0).path("text").asText());
        assertEquals(0, config.path("thinkingConfig").path("thinkingBudget").asInt(-1));
    }

    @Test
    void geminiCandidateWithoutPartsIsAnError() {
        String base = startServer(200,
            "{\"candidates\":[{\"content\":{\"role\":\"model\"},\"finishReason\":\"MAX_TOKENS\"}]}");

        IOException e = assertThrows(IOException.class,
            () -> factory.getProvider("gemini").complete("k", endpoint("gemini", base), "pick one"));
        assertTrue(e.getMessage().startsWith("Gemini response"));
    }

    @Test
    void geminiRequiresApiKey() {
        assertThrows(IOException.class,
            () -> factory.getProvider("gemini").complete(null, endpoint("gemini", "http://localhost:1"), "x"));
    }

    @Test
    void ollamaSendsOptions() throws Exception {
        String base = startServer(200, "{\"message\":{\"role\":\"assistant\",\"content\":\"flee\"}}");

        String reply = factory.getProvider("ollama").complete(null, endpoint("ollama", base), "pick one");

        assertEquals("flee", reply);
        assertEquals("/api/chat", path.get());
        assertFalse(received.get().path("stream").asBoolean());
        assertEquals(0.0, received.get().path("options").path("temperature").asDouble());
        assertEquals(ResolverEndpointConfig.DEFAULT_MAX_OUTPUT_TOKENS,
            received.get().path("options").path("num_predict").asInt());
    }

    @Test
    void missingModelIsRejected() {
        ResolverEndpointConfig noModel = new ResolverEndpointConfig("custom", " ", "http://localhost:1", 1000);
        assertThrows(IOException.class, () -> factory.getProvider("custom").complete(null, noModel, "x"));
    }
}
