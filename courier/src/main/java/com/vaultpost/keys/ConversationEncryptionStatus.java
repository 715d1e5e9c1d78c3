package com.vaultpost.keys;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether every participant of a conversation has a known public key.
 * {@code isEncrypted} always equals {@code readyForEncryption}.
 */
public record ConversationEncryptionStatus(
        @JsonProperty("isEncrypted") boolean encrypted,
        List<String> missingKeys,
        boolean readyForEncryption) {

    public ConversationEncryptionStatus {
        missingKeys = List.copyOf(missingKeys);
    }

    public static ConversationEncryptionStatus of(List<String> missingKeys) {
        boolean ready = missingKeys.isEmpty();
        return new ConversationEncryptionStatus(ready, missingKeys, ready);
    }
}
