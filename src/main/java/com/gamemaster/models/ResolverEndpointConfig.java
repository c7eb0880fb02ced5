package com.gamemaster.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Connection settings for the language model that backs the semantic fallback stage.
 * Sampling is not configurable: resolution requests always decode at temperature 0.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResolverEndpointConfig {

    public static final int DEFAULT_TIMEOUT_MS = 8000;
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 16;

    private String provider;
    private String model;
    private String baseUrl;
    private Integer timeoutMs;
    private Integer maxOutputTokens;

    public ResolverEndpointConfig() {
    }

    public ResolverEndpointConfig(String provider, String model, String baseUrl, Integer timeoutMs) {
        this.provider = provider;
        this.model = model;
        this.baseUrl = baseUrl;
        this.timeoutMs = timeoutMs;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Integer timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public void setMaxOutputTokens(Integer maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
    }

    public int effectiveTimeoutMs() {
        return timeoutMs != null && timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
    }

    public int effectiveMaxOutputTokens() {
        return maxOutputTokens != null && maxOutputTokens > 0 ? maxOutputTokens : DEFAULT_MAX_OUTPUT_TOKENS;
    }
}
