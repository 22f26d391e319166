package com.temenos.error;

public class RecordNotFoundException extends VaultException {

    private final String entityClass;
    private final String id;

    public RecordNotFoundException(String entityClass, String id) {
        this(entityClass, id, entityClass + " record not found: " + id);
    }

    public RecordNotFoundException(String entityClass, String id, String message) {
        super(message);
        this.entityClass = entityClass;
        this.id = id;
    }

    public String getEntityClass() { return entityClass; }
    public String getId() { return id; }
}
