package com.temenos.conversation;

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
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @GetMapping
    public Flux<ConversationSummary> list() {
        return conversationService.list();
    }

    @PostMapping
    public Mono<ConversationSaveResponse> save(@RequestBody ConversationRequest request) {
        return conversationService.save(request);
    }

    @GetMapping("/{id}")
    public Mono<Conversation> get(@PathVariable String id) {
        return conversationService.get(id);
    }

    @DeleteMapping("/{id}")
    public Mono<Void> delete(@PathVariable String id) {
        return conversationService.delete(id);
    }
}
