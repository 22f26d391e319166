package com.temenos.store;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Read-through cache of one entity class's decrypted listing.
 * Writers call {@link #invalidate()}; a load that races an invalidation is kept
 * under its old generation and therefore reloaded on the next read.
 */
final class RecordCache<T> {

    private record Snapshot<T>(long generation, List<T> records) {}

    private final AtomicLong generation = new AtomicLong();
    private volatile Snapshot<T> snapshot;

    List<T> get(Supplier<List<T>> loader) {
        long current = generation.get();
        Snapshot<T> cached = snapshot;
        if (cached != null && cached.generation() == current) {
            return cached.records();
        }
        List<T> loaded = List.copyOf(loader.get());
        snapshot = new Snapshot<>(current, loaded);
        return loaded;
    }

    void invalidate() {
        generation.incrementAndGet();
    }
}
