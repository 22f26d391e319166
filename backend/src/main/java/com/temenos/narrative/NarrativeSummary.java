package com.temenos.narrative;

import java.time.Instant;

public record NarrativeSummary(
        String id,
        String title,
        Instant created,
        Instant lastModified,
        int characterCount
) {

    static NarrativeSummary of(Narrative narrative) {
        return new NarrativeSummary(narrative.id(), narrative.title(), narrative.created(),
                narrative.lastModified(), narrative.characterCount());
    }
}
