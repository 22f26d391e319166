package com.temenos.error;

/** No completion provider is wired behind the transport boundary. */
public class ProviderUnavailableException extends VaultException {

    public ProviderUnavailableException(String message) {
        super(message);
    }
}
