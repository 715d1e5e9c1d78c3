package com.vaultpost.sync;

/** Body of {@code PUT /api/sync/network}. */
public record ConnectivityUpdate(boolean online) {
}
