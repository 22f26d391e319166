package com.temenos.conversation;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.temenos.store.StoredRecord;

public record Conversation(
        String id,
        String title,
        Instant created,
        Instant lastModified,
        List<ConversationMessage> messages
) implements StoredRecord {

    @Override
    @JsonIgnore
    public boolean isComplete() {
        return id != null && messages != null;
    }
}
