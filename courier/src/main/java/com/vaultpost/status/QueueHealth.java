package com.vaultpost.status;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Advisory aggregate over all tracked conversations.
 *
 * @param failedMessages      conversations currently in {@code error}
 * @param inProgress          conversations currently {@code syncing}
 * @param oldestPending       earliest {@code lastSyncTime} among conversations with pending messages, or null
 * @param estimatedTimeToSync one second per pending message
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueHealth(
        long totalPending,
        long failedMessages,
        long inProgress,
        Instant oldestPending,
        Duration estimatedTimeToSync) {
}
