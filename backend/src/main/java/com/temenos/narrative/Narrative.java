package com.temenos.narrative;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.temenos.store.StoredRecord;

/**
 * Long-form writing. {@code draftContent} is a scratch area kept alongside the main text
 * and survives saves that do not mention it.
 */
public record Narrative(
        String id,
        String title,
        String content,
        String draftContent,
        Instant created,
        Instant lastModified,
        int characterCount
) implements StoredRecord {

    @Override
    @JsonIgnore
    public boolean isComplete() {
        return id != null && title != null && content != null;
    }
}
