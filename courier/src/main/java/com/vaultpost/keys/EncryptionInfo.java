package com.vaultpost.keys;

import java.time.Instant;

/**
 * Describes the scheme protecting a conversation's messages.
 *
 * @param keyId {@code <conversationId>_<epochMillis>}
 */
public record EncryptionInfo(String algorithm, String keyId, int version, Metadata metadata) {

    public record Metadata(int rsaKeySize, int aesKeySize, int ivSize, Instant createdAt) {
    }
}
