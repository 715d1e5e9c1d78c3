package com.vaultpost.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Remote message service the queue drains into.
 */
@ConfigurationProperties(prefix = "vaultpost.transport")
public class TransportProperties {

    private String baseUrl = "http://localhost:8080";

    /** Sent as {@code Authorization: Bearer <token>} when set. */
    private String authToken;

    /** Upper bound for one request; a request that runs over counts as a network failure. */
    private Duration requestTimeout = Duration.ofSeconds(30);

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getAuthToken() { return authToken; }
    public void setAuthToken(String authToken) { this.authToken = authToken; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
}
