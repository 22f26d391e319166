package com.temenos.migration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.temenos.store.Blocking;
import com.temenos.store.EntityClass;
import com.temenos.store.MigratableStore;

import reactor.core.publisher.Mono;

@Service
public class MigrationService {

    private final Map<EntityClass, MigratableStore> stores = new EnumMap<>(EntityClass.class);
    private final MigrationJob job;

    public MigrationService(List<MigratableStore> stores, MigrationJob job) {
        stores.forEach(store -> this.stores.put(store.entityClass(), store));
        this.job = job;
    }

    public Mono<MigrationReport> migrate(String entityClass) {
        return Mono.fromCallable(() -> storeFor(entityClass))
                .flatMap(store -> Blocking.mono(() -> job.run(store)));
    }

    public Mono<MigrationStatus> status(String entityClass) {
        return Mono.fromCallable(() -> storeFor(entityClass))
                .flatMap(store -> Blocking.mono(() -> job.status(store)));
    }

    private MigratableStore storeFor(String pathName) {
        EntityClass entityClass = EntityClass.fromPathName(pathName);
        MigratableStore store = stores.get(entityClass);
        if (store == null) {
            throw new IllegalStateException("No store registered for " + pathName);
        }
        return store;
    }
}
