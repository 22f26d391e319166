package com.temenos.conversation;

/** One chat turn; role is "user", "assistant" or "system". */
public record ConversationMessage(String role, String content) {}
