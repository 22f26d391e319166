package com.temenos.migration;

public record MigrationStatus(
        String entityClass,
        int totalRecords,
        int migratedRecords,
        int legacyRecords,
        boolean migrationComplete,
        double migrationProgressPercent
) {}
