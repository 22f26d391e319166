package com.temenos.image;

public record ImageContent(byte[] bytes, String mimeType) {}
