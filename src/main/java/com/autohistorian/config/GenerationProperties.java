package com.autohistorian.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Text-generation backend configuration.
 *
 * Properties are prefixed with "generation" in application.yml.
 */
@ConfigurationProperties(prefix = "generation")
public class GenerationProperties {
    /** Gemini API base URL */
    private String baseUrl = "https://generativelanguage.googleapis.com";
    /** Gemini API key; generation calls fail permanently without it */
    private String apiKey;
    /** Model name, e.g. gemini-2.0-flash */
    private String model = "gemini-2.0-flash";
    /** Outbound request ceiling shared by every caller of the gateway */
    private int requestsPerMinute = 20;
    /** Retries after a throttling response before giving up */
    private int maxRetries = 3;
    /** Backoff before retry n is n times this unit */
    private Duration backoffUnit = Duration.ofSeconds(10);
    private double temperature = 0.2;
    /** Per-request timeout */
    private Duration timeout = Duration.ofSeconds(60);

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public int getRequestsPerMinute() { return requestsPerMinute; }
    public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Duration getBackoffUnit() { return backoffUnit; }
    public void setBackoffUnit(Duration backoffUnit) { this.backoffUnit = backoffUnit; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
}
