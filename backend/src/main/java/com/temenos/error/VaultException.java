package com.temenos.error;

/**
 * Root of the failures the vault core reports to its callers.
 * Raw cryptographic and parsing exceptions are translated into one of the
 * subclasses before they leave the core.
 */
public abstract class VaultException extends RuntimeException {

    protected VaultException(String message) {
        super(message);
    }

    protected VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
