package com.temenos.error;

/**
 * Decryption failed: wrong key, tampered blob, or bytes that are not a blob at all.
 * Never used for a missing record.
 */
public class IntegrityException extends VaultException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
