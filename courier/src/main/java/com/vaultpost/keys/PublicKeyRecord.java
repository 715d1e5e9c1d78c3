package com.vaultpost.keys;

import java.time.Instant;

/**
 * Cached public key of a peer.
 *
 * @param publicKey base64 SPKI encoding
 */
public record PublicKeyRecord(String userId, String publicKey, Instant createdAt) {
}
