package com.vaultpost.keys;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.vaultpost.crypto.UnsignedBytes;

/**
 * Plaintext of a key backup before passphrase sealing.
 *
 * @param publicKey  SPKI bytes
 * @param privateKey PKCS#8 bytes
 * @param createdAt  ISO-8601 instant
 */
public record KeyBackupRecord(
        String userAddress,
        @JsonSerialize(using = UnsignedBytes.Serializer.class)
        @JsonDeserialize(using = UnsignedBytes.Deserializer.class)
        byte[] publicKey,
        @JsonSerialize(using = UnsignedBytes.Serializer.class)
        @JsonDeserialize(using = UnsignedBytes.Deserializer.class)
        byte[] privateKey,
        String createdAt,
        int version) {

    public static final int CURRENT_VERSION = 1;

    @Override
    public String toString() {
        return "KeyBackupRecord[userAddress=" + userAddress + ", version=" + version + "]";
    }
}
