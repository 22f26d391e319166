package com.temenos.prompt;

import org.springframework.stereotype.Service;

import com.temenos.error.InvalidRequestException;
import com.temenos.error.RecordNotFoundException;
import com.temenos.store.Blocking;
import com.temenos.store.EncryptedEntityStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * System prompts are small, so listings return them whole. Creating and updating are separate
 * operations: an update of an unknown id is a not-found, never an implicit create.
 */
@Service
public class SystemPromptService {

    private final EncryptedEntityStore<SystemPrompt> store;

    public SystemPromptService(EncryptedEntityStore<SystemPrompt> store) {
        this.store = store;
    }

    public Flux<SystemPrompt> list() {
        return Blocking.flux(store::list);
    }

    public Mono<SystemPrompt> get(String id) {
        return Blocking.mono(() -> store.get(id));
    }

    public Mono<SystemPrompt> create(SystemPromptRequest request) {
        return validate(request).then(Blocking.mono(() -> store.save(null,
                (id, created, now, previous) -> new SystemPrompt(id, request.title(), request.body(), created, now))));
    }

    public Mono<SystemPrompt> update(String id, SystemPromptRequest request) {
        return validate(request).then(Blocking.mono(() -> store.save(id, (recordId, created, now, previous) -> {
            if (previous.isEmpty()) {
                throw new RecordNotFoundException(store.entityClass().pathName(), recordId);
            }
            return new SystemPrompt(recordId, request.title(), request.body(), created, now);
        })));
    }

    public Mono<Void> delete(String id) {
        return Blocking.run(() -> store.delete(id));
    }

    private static Mono<Void> validate(SystemPromptRequest request) {
        if (request.title() == null || request.title().isBlank()
                || request.body() == null || request.body().isBlank()) {
            return Mono.error(new InvalidRequestException("Title and body are required"));
        }
        return Mono.empty();
    }
}
