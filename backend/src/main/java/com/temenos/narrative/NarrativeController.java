package com.temenos.narrative;

import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/narratives")
public class NarrativeController {

    private final NarrativeService narrativeService;

    public NarrativeController(NarrativeService narrativeService) {
        this.narrativeService = narrativeService;
    }

    @GetMapping
    public Flux<NarrativeSummary> list() {
        return narrativeService.list();
    }

    /** Creates when the body has no id, otherwise overwrites that narrative. */
    @PostMapping
    public Mono<NarrativeSaveResponse> save(@RequestBody NarrativeRequest request) {
        return narrativeService.save(request);
    }

    @GetMapping("/{id}")
    public Mono<Narrative> get(@PathVariable String id) {
        return narrativeService.get(id);
    }

    @DeleteMapping("/{id}")
    public Mono<Void> delete(@PathVariable String id) {
        return narrativeService.delete(id);
    }
}
