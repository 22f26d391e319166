package com.temenos.error;

/** A secret key is missing or malformed. Not retryable without an operator fix. */
public class ConfigException extends VaultException {

    public ConfigException(String message) {
        super(message);
    }
}
