package com.temenos.narrative;

/**
 * Save payload. {@code id} is null for a new narrative; {@code draftContent} null means
 * "keep whatever draft is already stored".
 */
public record NarrativeRequest(
        String id,
        String title,
        String content,
        String draftContent
) {}
