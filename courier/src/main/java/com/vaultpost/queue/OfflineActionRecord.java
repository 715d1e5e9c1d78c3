package com.vaultpost.queue;

import java.time.Instant;

/**
 * Persisted offline action.
 *
 * The type tag is kept as the stored string so rows written by a newer build,
 * or with a kind that no longer exists, can still be loaded and failed.
 *
 * @param data JSON body of the action kind
 */
public record OfflineActionRecord(
        String id,
        String type,
        String data,
        Instant timestamp,
        int retryCount,
        int maxRetries,
        ActionStatus status) {

    public OfflineActionRecord withRetryCount(int newRetryCount) {
        return new OfflineActionRecord(id, type, data, timestamp, newRetryCount, maxRetries, status);
    }

    public OfflineActionRecord withStatus(ActionStatus newStatus) {
        return new OfflineActionRecord(id, type, data, timestamp, retryCount, maxRetries, newStatus);
    }
}
