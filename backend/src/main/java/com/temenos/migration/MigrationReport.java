package com.temenos.migration;

import java.util.List;

/**
 * Outcome of one pass. Per-record failures are aggregated here instead of being thrown;
 * {@code errors} holds at most the first ten messages while {@code errorCount} counts them all.
 */
public record MigrationReport(
        String entityClass,
        boolean success,
        int migratedCount,
        int skippedCount,
        int errorCount,
        int totalRecords,
        List<String> errors
) {}
