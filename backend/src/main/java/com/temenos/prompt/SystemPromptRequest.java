package com.temenos.prompt;

public record SystemPromptRequest(String title, String body) {}
