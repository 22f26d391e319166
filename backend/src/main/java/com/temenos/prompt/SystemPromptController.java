package com.temenos.prompt;

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
@RequestMapping("/api/system-prompts")
public class SystemPromptController {

    private final SystemPromptService systemPromptService;

    public SystemPromptController(SystemPromptService systemPromptService) {
        this.systemPromptService = systemPromptService;
    }

    @GetMapping
    public Flux<SystemPrompt> list() {
        return systemPromptService.list();
    }

    @PostMapping
    public Mono<SystemPrompt> create(@RequestBody SystemPromptRequest request) {
        return systemPromptService.create(request);
    }

    @GetMapping("/{id}")
    public Mono<SystemPrompt> get(@PathVariable String id) {
        return systemPromptService.get(id);
    }

    @PutMapping("/{id}")
    public Mono<SystemPrompt> update(@PathVariable String id, @RequestBody SystemPromptRequest request) {
        return systemPromptService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public Mono<Void> delete(@PathVariable String id) {
        return systemPromptService.delete(id);
    }
}
