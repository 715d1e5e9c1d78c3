package com.vaultpost.crypto;

public class KeyBackupException extends CryptoException {

    public KeyBackupException(String message) {
        super(message);
    }

    public KeyBackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
