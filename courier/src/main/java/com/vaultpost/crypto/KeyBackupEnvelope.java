package com.vaultpost.crypto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * Passphrase-sealed payload of a key backup: AES-GCM ciphertext plus the PBKDF2
 * salt and GCM IV needed to open it. Serialized as JSON, then base64 for export.
 */
public record KeyBackupEnvelope(
        @JsonSerialize(using = UnsignedBytes.Serializer.class)
        @JsonDeserialize(using = UnsignedBytes.Deserializer.class)
        byte[] encryptedData,

        @JsonSerialize(using = UnsignedBytes.Serializer.class)
        @JsonDeserialize(using = UnsignedBytes.Deserializer.class)
        byte[] salt,

        @JsonSerialize(using = UnsignedBytes.Serializer.class)
        @JsonDeserialize(using = UnsignedBytes.Deserializer.class)
        byte[] iv
) {
}
