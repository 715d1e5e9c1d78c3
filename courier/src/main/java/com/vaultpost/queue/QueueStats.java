package com.vaultpost.queue;

/** Row counts of the local queue tables. */
public record QueueStats(long pendingMessages, long sendingMessages, long failedMessages, long offlineActions) {
}
