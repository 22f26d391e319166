package com.temenos.context;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.temenos.store.StoredRecord;

/** Background notes a user keeps to paste into chats. */
public record ContextNote(
        String id,
        String title,
        String body,
        Instant created,
        Instant lastModified
) implements StoredRecord {

    @Override
    @JsonIgnore
    public boolean isComplete() {
        return id != null && title != null && body != null;
    }
}
