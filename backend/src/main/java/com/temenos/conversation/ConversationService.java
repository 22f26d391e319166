package com.temenos.conversation;

import java.util.List;

import org.springframework.stereotype.Service;

import com.temenos.error.InvalidRequestException;
import com.temenos.store.Blocking;
import com.temenos.store.EncryptedEntityStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
public class ConversationService {

    static final String DEFAULT_TITLE = "New Conversation";
    static final int MAX_TITLE_LENGTH = 50;

    private final EncryptedEntityStore<Conversation> store;

    public ConversationService(EncryptedEntityStore<Conversation> store) {
        this.store = store;
    }

    public Flux<ConversationSummary> list() {
        return Blocking.flux(store::list).map(ConversationSummary::of);
    }

    public Mono<Conversation> get(String id) {
        return Blocking.mono(() -> store.get(id));
    }

    public Mono<ConversationSaveResponse> save(ConversationRequest request) {
        if (request.messages() == null) {
            return Mono.error(new InvalidRequestException("Messages array is required"));
        }
        List<ConversationMessage> messages = List.copyOf(request.messages());
        String title = titleFor(messages);
        return Blocking.mono(() -> store.save(request.id(),
                        (id, created, now, previous) -> new Conversation(id, title, created, now, messages)))
                .map(saved -> new ConversationSaveResponse(true, saved.id(), saved.title()));
    }

    public Mono<Void> delete(String id) {
        return Blocking.run(() -> store.delete(id));
    }

    /** First user message, cut to 50 characters with an ellipsis. */
    static String titleFor(List<ConversationMessage> messages) {
        return messages.stream()
                .filter(m -> "user".equals(m.role()) && m.content() != null)
                .findFirst()
                .map(m -> {
                    String content = m.content().trim();
                    return content.length() <= MAX_TITLE_LENGTH
                            ? content
                            : content.substring(0, MAX_TITLE_LENGTH - 3) + "...";
                })
                .orElse(DEFAULT_TITLE);
    }
}
