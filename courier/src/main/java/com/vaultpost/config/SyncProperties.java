package com.vaultpost.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry, backoff and scheduling policy of the sync engine.
 *
 * Retry delay for attempt {@code n} is {@code min(baseDelay * 2^n, maxDelay)}.
 */
@ConfigurationProperties(prefix = "vaultpost.sync")
public class SyncProperties {

    /** A queued message is moved to the failed table once its retry count reaches this value. */
    private int maxRetries = 5;

    private Duration baseDelay = Duration.ofSeconds(1);

    private Duration maxDelay = Duration.ofSeconds(60);

    /** Period of the fallback sync pass. */
    private Duration syncInterval = Duration.ofSeconds(30);

    /** Failed messages older than this are pruned at the end of a sync pass. */
    private Duration failedRetention = Duration.ofDays(7);

    /** Max retries for offline actions queued without an explicit limit. */
    private int defaultActionMaxRetries = 3;

    /** Connectivity assumed at startup, before the first transition is reported. */
    private boolean startOnline = true;

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Duration getBaseDelay() { return baseDelay; }
    public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }

    public Duration getMaxDelay() { return maxDelay; }
    public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

    public Duration getSyncInterval() { return syncInterval; }
    public void setSyncInterval(Duration syncInterval) { this.syncInterval = syncInterval; }

    public Duration getFailedRetention() { return failedRetention; }
    public void setFailedRetention(Duration failedRetention) { this.failedRetention = failedRetention; }

    public int getDefaultActionMaxRetries() { return defaultActionMaxRetries; }
    public void setDefaultActionMaxRetries(int defaultActionMaxRetries) { this.defaultActionMaxRetries = defaultActionMaxRetries; }

    public boolean isStartOnline() { return startOnline; }
    public void setStartOnline(boolean startOnline) { this.startOnline = startOnline; }
}
