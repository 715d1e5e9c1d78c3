package com.vaultpost.store;

import java.time.Instant;

/** Row of {@code key_pairs}: base64 SPKI public key and base64 PKCS#8 private key. */
public record StoredKeyPair(String userId, String publicKey, String privateKey, Instant createdAt) {

    @Override
    public String toString() {
        return "StoredKeyPair[userId=" + userId + ", createdAt=" + createdAt + "]";
    }
}
