package com.temenos.transport;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/healing")
public class HealingController {

    private final HealingService healingService;

    public HealingController(HealingService healingService) {
        this.healingService = healingService;
    }

    @PostMapping
    public Mono<HealingResponse> heal(@RequestBody HealingRequest request) {
        return healingService.heal(request);
    }
}
