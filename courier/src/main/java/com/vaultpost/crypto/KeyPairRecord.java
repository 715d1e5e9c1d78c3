package com.vaultpost.crypto;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Instant;

/**
 * A user's active RSA key pair. Rotation replaces the record; it is never mutated.
 */
public record KeyPairRecord(
        String userId,
        PublicKey publicKey,
        PrivateKey privateKey,
        Instant createdAt
) {

    public KeyPair toKeyPair() {
        return new KeyPair(publicKey, privateKey);
    }

    @Override
    public String toString() {
        // private key material stays out of logs
        return "KeyPairRecord[userId=" + userId + ", createdAt=" + createdAt + "]";
    }
}
