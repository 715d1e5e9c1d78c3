package com.vaultpost.status;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-conversation sync state. {@code ERROR} and {@code OFFLINE} both return to
 * {@code SYNCING}; {@code SYNCED} holds until the next change.
 */
public enum SyncState {
    SYNCING,
    SYNCED,
    ERROR,
    OFFLINE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SyncState fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
