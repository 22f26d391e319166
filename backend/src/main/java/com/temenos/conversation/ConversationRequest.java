package com.temenos.conversation;

import java.util.List;

public record ConversationRequest(
        String id,                          // null starts a new conversation
        List<ConversationMessage> messages  // full history; each save replaces it
) {}
