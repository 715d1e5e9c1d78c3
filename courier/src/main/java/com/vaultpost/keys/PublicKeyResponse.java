package com.vaultpost.keys;

/** Body of the public key endpoints; carries the base64 SPKI key only. */
public record PublicKeyResponse(String userId, String publicKey) {
}
