package com.vaultpost.sync;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param lastSyncAttempt start of the most recent sync pass, or null before the first one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NetworkStatus(boolean online, boolean syncInProgress, Instant lastSyncAttempt) {
}
