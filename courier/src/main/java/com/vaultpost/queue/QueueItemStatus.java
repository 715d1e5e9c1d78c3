package com.vaultpost.queue;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * {@code PENDING} items wait for a sync pass or a retry timer; {@code SENDING}
 * items are claimed by exactly one in-flight send attempt.
 */
public enum QueueItemStatus {
    PENDING,
    SENDING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static QueueItemStatus fromWire(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
