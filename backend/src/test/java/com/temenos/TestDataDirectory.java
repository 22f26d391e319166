package com.temenos;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.springframework.test.context.DynamicPropertyRegistry;

/**
 * Points {@code temenos.data-dir} at a fresh temporary directory for a Spring test class.
 * Keys come from {@code application-test.yml}.
 */
public final class TestDataDirectory {

    private TestDataDirectory() {}

    public static void register(DynamicPropertyRegistry registry) {
        Path dir;
        try {
            dir = Files.createTempDirectory("temenos-test-");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        dir.toFile().deleteOnExit();
        registry.add("temenos.data-dir", dir::toString);
    }
}
