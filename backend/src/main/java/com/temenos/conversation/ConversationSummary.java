package com.temenos.conversation;

import java.time.Instant;

public record ConversationSummary(
        String id,
        String title,
        Instant created,
        Instant lastModified,
        int messageCount
) {

    static ConversationSummary of(Conversation conversation) {
        return new ConversationSummary(conversation.id(), conversation.title(), conversation.created(),
                conversation.lastModified(), conversation.messages().size());
    }
}
