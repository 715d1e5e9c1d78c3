package com.vaultpost.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "vaultpost.status")
public class StatusProperties {

    /** How often syncing conversations are scanned for stalls. */
    private Duration healthCheckInterval = Duration.ofSeconds(5);

    /** A syncing conversation with no transition for this long is marked as errored. */
    private Duration stallTimeout = Duration.ofMinutes(5);

    /** Errored conversations are re-armed by retryFailedSyncs only below this retry count. */
    private int maxSyncRetries = 3;

    /** Per-subscriber buffer of status snapshots. */
    private int eventBufferSize = 256;

    public Duration getHealthCheckInterval() { return healthCheckInterval; }
    public void setHealthCheckInterval(Duration healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }

    public Duration getStallTimeout() { return stallTimeout; }
    public void setStallTimeout(Duration stallTimeout) { this.stallTimeout = stallTimeout; }

    public int getMaxSyncRetries() { return maxSyncRetries; }
    public void setMaxSyncRetries(int maxSyncRetries) { this.maxSyncRetries = maxSyncRetries; }

    public int getEventBufferSize() { return eventBufferSize; }
    public void setEventBufferSize(int eventBufferSize) { this.eventBufferSize = eventBufferSize; }
}
