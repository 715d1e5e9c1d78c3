package com.vaultpost.crypto;

public class MessageEncryptionException extends CryptoException {

    public MessageEncryptionException(String message) {
        super(message);
    }

    public MessageEncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
