package com.temenos.image;

import java.net.URI;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.temenos.config.TemenosProperties;
import com.temenos.error.InvalidRequestException;

import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class ImageFetcherTest {

    private final ImageFetcher fetcher = new ImageFetcher(WebClient.builder(),
            new TemenosProperties(null, null, "data", 10_485_760, Duration.ofSeconds(5)));

    @Test
    void nonHttpSchemesAreRefusedWithoutConnecting() {
        StepVerifier.create(fetcher.fetch("file:///etc/passwd"))
                .expectError(InvalidRequestException.class)
                .verify();
        StepVerifier.create(fetcher.fetch("not a url"))
                .expectError(InvalidRequestException.class)
                .verify();
    }

    @Test
    void fileNameComesFromPathOrContentType() {
        assertEquals("cat.png", ImageFetcher.fileNameFor(URI.create("https://x.test/a/cat.png"), MediaType.IMAGE_PNG));
        assertEquals("cat.jpeg",
                ImageFetcher.fileNameFor(URI.create("https://x.test/a/cat"), MediaType.IMAGE_JPEG));
        assertEquals("image.gif", ImageFetcher.fileNameFor(URI.create("https://x.test/"), MediaType.IMAGE_GIF));
    }

    @Test
    void sizeCapIsDescribedInMegabytes() {
        assertEquals("10MB", ImageFetcher.describe(10_485_760));
        assertEquals("1000 bytes", ImageFetcher.describe(1000));
    }
}
