package com.vaultpost.status;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Snapshot of one conversation's sync state, as persisted and as published to subscribers.
 *
 * @param progress     0 to 100
 * @param lastSyncTime time of the last transition; the stall check measures from here
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncStatus(
        String conversationId,
        SyncState status,
        int progress,
        int pendingMessages,
        Instant lastSyncTime,
        String errorMessage,
        int retryCount) {

    public static SyncStatus initial(String conversationId, Instant now) {
        return new SyncStatus(conversationId, SyncState.OFFLINE, 0, 0, now, null, 0);
    }
}
