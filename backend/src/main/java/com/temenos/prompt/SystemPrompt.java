package com.temenos.prompt;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.temenos.store.StoredRecord;

public record SystemPrompt(
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
