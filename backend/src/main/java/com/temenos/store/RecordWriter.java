package com.temenos.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Builds the full record to persist. {@code created} is already carried over from
 * {@code previous} when an earlier version exists.
 */
@FunctionalInterface
public interface RecordWriter<T extends StoredRecord> {

    T write(String id, Instant created, Instant now, Optional<T> previous);
}
