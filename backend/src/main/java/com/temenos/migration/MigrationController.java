package com.temenos.migration;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

/**
 * Operator endpoints for upgrading stored ciphertext. {@code entityClass} is one of
 * conversations, narratives, system-prompts, contexts or images.
 */
@RestController
@RequestMapping("/api/migrations")
public class MigrationController {

    private final MigrationService migrationService;

    public MigrationController(MigrationService migrationService) {
        this.migrationService = migrationService;
    }

    @PostMapping("/{entityClass}")
    public Mono<MigrationReport> migrate(@PathVariable String entityClass) {
        return migrationService.migrate(entityClass);
    }

    @GetMapping("/{entityClass}")
    public Mono<MigrationStatus> status(@PathVariable String entityClass) {
        return migrationService.status(entityClass);
    }
}
