package com.temenos.transport;

/** {@code response} is sealed with the transport key. */
public record HealingResponse(String response) {}
