package com.vaultpost.crypto;

/**
 * Base type for failures raised by key management and message encryption.
 * All subclasses are fatal to the call that produced them.
 */
public class CryptoException extends RuntimeException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
