package com.temenos.conversation;

public record ConversationSaveResponse(
        boolean success,
        String conversationId,
        String title
) {}
