package com.temenos.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** File helpers shared by the stores. Every write replaces the whole file. */
public final class BlobFiles {

    public static final String TEMP_SUFFIX = ".tmp";

    private BlobFiles() {}

    public static void ensureDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + directory, e);
        }
    }

    /**
     * Reads a text file.
     *
     * @throws java.nio.file.NoSuchFileException when the file is absent, so callers can map it to not-found
     */
    public static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /** Writes to a sibling temp file, then moves it over the target. */
    public static void writeAtomically(Path target, String content) {
        Path directory = target.toAbsolutePath().getParent();
        ensureDirectory(directory);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + target.getFileName() + ".", TEMP_SUFFIX);
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Cannot write " + target.getFileName(), e);
        }
    }

    /** @return true when a file was removed */
    public static boolean delete(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete " + file.getFileName(), e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException suppressed) {
            // the original failure is the one worth reporting
        }
    }
}
