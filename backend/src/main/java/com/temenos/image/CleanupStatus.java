package com.temenos.image;

public record CleanupStatus(
        int fileCount,
        int metadataCount,
        boolean hasData
) {}
