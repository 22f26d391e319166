package com.temenos.migration;

/**
 * Per-record lifecycle inside one migration pass:
 * {@code UNMIGRATED -> MIGRATING -> MIGRATED}, or {@code SKIPPED} when already current,
 * or {@code ERROR} when the legacy decrypt or the rewrite fails.
 */
public enum MigrationState {
    UNMIGRATED,
    MIGRATING,
    MIGRATED,
    SKIPPED,
    ERROR
}
