package com.temenos.narrative;

import java.time.Instant;

public record NarrativeSaveResponse(
        boolean success,
        String narrativeId,
        String title,
        Instant created,
        Instant lastModified,
        int characterCount
) {}
