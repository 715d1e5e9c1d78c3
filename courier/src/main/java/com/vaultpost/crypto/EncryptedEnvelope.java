package com.vaultpost.crypto;

import java.util.Arrays;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * One encrypted message: AES-GCM ciphertext, the session key wrapped with the
 * recipient's RSA-OAEP public key, and the 12-byte GCM IV.
 *
 * Byte arrays travel as arrays of unsigned integers. Instances are treated as
 * immutable; accessors return the backing arrays, callers must not modify them.
 */
public record EncryptedEnvelope(
        @JsonSerialize(using = UnsignedBytes.Serializer.class)
        @JsonDeserialize(using = UnsignedBytes.Deserializer.class)
        byte[] encryptedContent,

        @JsonSerialize(using = UnsignedBytes.Serializer.class)
        @JsonDeserialize(using = UnsignedBytes.Deserializer.class)
        byte[] encryptedKey,

        @JsonSerialize(using = UnsignedBytes.Serializer.class)
        @JsonDeserialize(using = UnsignedBytes.Deserializer.class)
        byte[] iv
) {

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncryptedEnvelope other)) return false;
        return Arrays.equals(encryptedContent, other.encryptedContent)
                && Arrays.equals(encryptedKey, other.encryptedKey)
                && Arrays.equals(iv, other.iv);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(encryptedContent);
        result = 31 * result + Arrays.hashCode(encryptedKey);
        result = 31 * result + Arrays.hashCode(iv);
        return result;
    }

    @Override
    public String toString() {
        return "EncryptedEnvelope[content=" + length(encryptedContent) + "B, key="
                + length(encryptedKey) + "B, iv=" + length(iv) + "B]";
    }

    private static int length(byte[] b) {
        return b == null ? 0 : b.length;
    }
}
