package com.temenos.error;

/** Decrypted plaintext (or the image index) is not valid JSON for the expected shape. */
public class SerializationException extends VaultException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
