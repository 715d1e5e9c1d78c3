package com.vaultpost.crypto;

public class PublicKeyImportException extends CryptoException {

    public PublicKeyImportException(String message) {
        super(message);
    }

    public PublicKeyImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
