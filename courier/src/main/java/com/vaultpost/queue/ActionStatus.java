package com.vaultpost.queue;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/** Claim state of an offline action; mirrors {@link QueueItemStatus} for messages. */
public enum ActionStatus {
    PENDING,
    EXECUTING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActionStatus fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
