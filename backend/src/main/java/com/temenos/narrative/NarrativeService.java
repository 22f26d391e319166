package com.temenos.narrative;

import org.springframework.stereotype.Service;

import com.temenos.error.InvalidRequestException;
import com.temenos.store.Blocking;
import com.temenos.store.EncryptedEntityStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
public class NarrativeService {

    private final EncryptedEntityStore<Narrative> store;

    public NarrativeService(EncryptedEntityStore<Narrative> store) {
        this.store = store;
    }

    public Flux<NarrativeSummary> list() {
        return Blocking.flux(store::list).map(NarrativeSummary::of);
    }

    public Mono<Narrative> get(String id) {
        return Blocking.mono(() -> store.get(id));
    }

    public Mono<NarrativeSaveResponse> save(NarrativeRequest request) {
        if (request.title() == null || request.title().isBlank()
                || request.content() == null || request.content().isEmpty()) {
            return Mono.error(new InvalidRequestException("Title and content are required"));
        }
        return Blocking.mono(() -> store.save(request.id(), (id, created, now, previous) -> {
            String draft = request.draftContent() != null
                    ? request.draftContent()
                    : previous.map(Narrative::draftContent).orElse("");
            return new Narrative(id, request.title().trim(), request.content(), draft,
                    created, now, request.content().length());
        })).map(saved -> new NarrativeSaveResponse(true, saved.id(), saved.title(),
                saved.created(), saved.lastModified(), saved.characterCount()));
    }

    public Mono<Void> delete(String id) {
        return Blocking.run(() -> store.delete(id));
    }
}
