package com.temenos.image;

import java.time.Instant;

/** What callers see of an image: the index entry minus storage details, plus its content URL. */
public record ImageView(
        String id,
        String title,
        Instant created,
        Instant lastModified,
        String url,
        long size,
        String mimeType
) {

    static ImageView of(ImageMetadata metadata) {
        return new ImageView(metadata.id(), metadata.title(), metadata.created(), metadata.lastModified(),
                "/api/images/" + metadata.id() + "/content", metadata.size(), metadata.mimeType());
    }
}
