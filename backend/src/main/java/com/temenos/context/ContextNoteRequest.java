package com.temenos.context;

public record ContextNoteRequest(String title, String body) {}
