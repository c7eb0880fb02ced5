package com.gamemaster;

import com.gamemaster.models.ResolverEndpointConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void defaultsPointAtGemini() {
        ResolverEndpointConfig endpoint = new AppConfig.Builder().parseArgs(new String[0]).buildResolverEndpoint();
        assertEquals("gemini", endpoint.getProvider());
        assertEquals("gemini-2.5-flash", endpoint.getModel());
        assertNull(endpoint.getBaseUrl());
        assertEquals(8000, endpoint.effectiveTimeoutMs());
        assertEquals(16, endpoint.effectiveMaxOutputTokens());
    }

    @Test
    void parsesBothFlagForms() {
        AppConfig.Builder builder = new AppConfig.Builder().parseArgs(new String[] {
            "--dev",
            "--world", "worlds/custom.json",
            "--resolver-provider=Ollama",
            "--resolver-model", "llama3",
            "--resolver-base-url=http://localhost:11434/",
            "--resolver-timeout-ms=2500"
        });
        ResolverEndpointConfig endpoint = builder.buildResolverEndpoint();

        assertTrue(builder.isDevMode());
        assertEquals(Paths.get("worlds/custom.json").toAbsolutePath().normalize(), builder.getWorldPath());
        assertEquals("ollama", endpoint.getProvider());
        assertEquals("llama3", endpoint.getModel());
        assertEquals("http://localhost:11434/", endpoint.getBaseUrl());
        assertEquals(2500, endpoint.effectiveTimeoutMs());
    }

    @Test
    void badNumbersKeepDefaults() {
        ResolverEndpointConfig endpoint = new AppConfig.Builder()
            .parseArgs(new String[] {"--resolver-timeout-ms", "soon", "--port=abc"})
            .buildResolverEndpoint();
        assertEquals(ResolverEndpointConfig.DEFAULT_TIMEOUT_MS, endpoint.effectiveTimeoutMs());
    }

    @Test
    void providerNoneDisablesFallback() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--resolver-provider=none", "--port=0"})
            .resolverApiKey("unused")
            .build();
        assertFalse(config.isResolverEnabled());
        assertEquals("unused", config.getResolverApiKey());

        AppConfig enabled = new AppConfig.Builder().port(0).resolverApiKey("k").build();
        assertTrue(enabled.isResolverEnabled());
    }
}
