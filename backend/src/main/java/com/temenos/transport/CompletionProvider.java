package com.temenos.transport;

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * Chat-completion backend behind the healing route. No implementation ships with this
 * service; when no bean is present the route answers 503.
 */
public interface CompletionProvider {

    /**
     * @param model    model name requested by the client
     * @param messages system message first, then alternating user/assistant turns ending with a user turn;
     *                 all plaintext
     * @return the assistant's reply in plaintext
     */
    Mono<String> complete(String model, List<ChatTurn> messages);
}
