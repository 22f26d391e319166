package com.temenos.image;

import java.util.List;

public record CleanupReport(
        boolean success,
        int deletedFiles,
        int deletedMetadata,
        List<String> errors
) {}
