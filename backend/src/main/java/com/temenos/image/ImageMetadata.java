package com.temenos.image;

import java.time.Instant;

/**
 * One entry of the plaintext image index ({@code images.json}). Lets listings show title, size
 * and type without decrypting blobs, and lets migration skip records flagged as version 2.
 * {@code encryptionVersion} is absent on entries written before versioning existed.
 */
public record ImageMetadata(
        String id,
        String title,
        String filename,
        Instant created,
        Instant lastModified,
        long size,
        String mimeType,
        Integer encryptionVersion
) {

    ImageMetadata withEncryptionVersion(int version, Instant modified) {
        return new ImageMetadata(id, title, filename, created, modified, size, mimeType, version);
    }
}
