package com.temenos.context;

import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/contexts")
public class ContextNoteController {

    private final ContextNoteService contextNoteService;

    public ContextNoteController(ContextNoteService contextNoteService) {
        this.contextNoteService = contextNoteService;
    }

    @GetMapping
    public Flux<ContextNote> list() {
        return contextNoteService.list();
    }

    @PostMapping
    public Mono<ContextNote> create(@RequestBody ContextNoteRequest request) {
        return contextNoteService.create(request);
    }

    @GetMapping("/{id}")
    public Mono<ContextNote> get(@PathVariable String id) {
        return contextNoteService.get(id);
    }

    @PutMapping("/{id}")
    public Mono<ContextNote> update(@PathVariable String id, @RequestBody ContextNoteRequest request) {
        return contextNoteService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public Mono<Void> delete(@PathVariable String id) {
        return contextNoteService.delete(id);
    }
}
