package com.temenos.store;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** A JSON-serializable record persisted as one encrypted file. */
public interface StoredRecord {

    String id();

    Instant created();

    Instant lastModified();

    /** Records missing required fields are left out of listings. */
    @JsonIgnore
    default boolean isComplete() {
        return id() != null;
    }
}
