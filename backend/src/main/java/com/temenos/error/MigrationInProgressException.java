package com.temenos.error;

public class MigrationInProgressException extends VaultException {

    public MigrationInProgressException(String entityClass) {
        super("Migration already running for " + entityClass);
    }
}
