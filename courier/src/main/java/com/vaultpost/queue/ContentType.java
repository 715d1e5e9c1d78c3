package com.vaultpost.queue;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of payload carried by a queued message. */
public enum ContentType {
    TEXT,
    IMAGE,
    FILE,
    POST_SHARE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ContentType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Content type is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
