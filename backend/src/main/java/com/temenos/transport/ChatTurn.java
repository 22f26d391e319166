package com.temenos.transport;

/** A chat turn on the wire; {@code content} is sealed with the transport key, {@code role} is not. */
public record ChatTurn(String role, String content) {}
