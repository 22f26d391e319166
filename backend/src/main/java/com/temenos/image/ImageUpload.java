package com.temenos.image;

/** Raw image bytes as received from a multipart upload or a URL download. */
public record ImageUpload(byte[] bytes, String mimeType, String originalName) {}
