package com.temenos.context;

import org.springframework.stereotype.Service;

import com.temenos.error.InvalidRequestException;
import com.temenos.error.RecordNotFoundException;
import com.temenos.store.Blocking;
import com.temenos.store.EncryptedEntityStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
public class ContextNoteService {

    private final EncryptedEntityStore<ContextNote> store;

    public ContextNoteService(EncryptedEntityStore<ContextNote> store) {
        this.store = store;
    }

    public Flux<ContextNote> list() {
        return Blocking.flux(store::list);
    }

    public Mono<ContextNote> get(String id) {
        return Blocking.mono(() -> store.get(id));
    }

    public Mono<ContextNote> create(ContextNoteRequest request) {
        return validate(request).then(Blocking.mono(() -> store.save(null,
                (id, created, now, previous) -> new ContextNote(id, request.title(), request.body(), created, now))));
    }

    public Mono<ContextNote> update(String id, ContextNoteRequest request) {
        return validate(request).then(Blocking.mono(() -> store.save(id, (recordId, created, now, previous) -> {
            if (previous.isEmpty()) {
                throw new RecordNotFoundException(store.entityClass().pathName(), recordId);
            }
            return new ContextNote(recordId, request.title(), request.body(), created, now);
        })));
    }

    public Mono<Void> delete(String id) {
        return Blocking.run(() -> store.delete(id));
    }

    private static Mono<Void> validate(ContextNoteRequest request) {
        if (request.title() == null || request.title().isBlank()
                || request.body() == null || request.body().isBlank()) {
            return Mono.error(new InvalidRequestException("Title and body are required"));
        }
        return Mono.empty();
    }
}
