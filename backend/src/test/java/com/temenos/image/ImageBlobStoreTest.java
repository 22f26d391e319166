package com.temenos.image;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.temenos.crypto.AesGcmCipher;
import com.temenos.crypto.CryptoFixtures;
import com.temenos.crypto.EncryptionVersion;
import com.temenos.crypto.LegacyCbcCipher;
import com.temenos.crypto.VaultCrypto;
import com.temenos.error.RecordNotFoundException;
import com.temenos.error.SerializationException;
import com.temenos.store.RecordJson;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the blob-plus-index image store against a temporary data directory.
 */
class ImageBlobStoreTest {

    private static final Instant T0 = Instant.parse("2025-04-02T08:00:00Z");
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 13, 10, 26, 10, 1, 2, 3};

    @TempDir
    Path dataDir;

    private final RecordJson json = new RecordJson();
    private ImageBlobStore store;

    @BeforeEach
    void setup() {
        VaultCrypto crypto = new VaultCrypto(CryptoFixtures::key, new AesGcmCipher(), new LegacyCbcCipher());
        store = new ImageBlobStore(dataDir, json, crypto, Clock.fixed(T0, ZoneOffset.UTC));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void writeIndex(List<ImageMetadata> entries) throws Exception {
        Files.writeString(dataDir.resolve("images.json"), json.writePretty(entries));
    }

    private void writeBlob(String filename, String blob) throws Exception {
        Files.createDirectories(dataDir.resolve("images"));
        Files.writeString(dataDir.resolve("images").resolve(filename), blob);
    }

    private static ImageMetadata entry(String id, String filename, Instant created, Integer version) {
        return new ImageMetadata(id, "title " + id, filename, created, created, 11, "image/png", version);
    }

    // ── Save / read ──────────────────────────────────────────────────────────

    @Test
    void saveWritesEncryptedBlobAndIndexEntry() throws Exception {
        ImageMetadata saved = store.save("  Sunset  ", PNG, "image/png", "photo.PNG");

        assertEquals("Sunset", saved.title());
        assertEquals(PNG.length, saved.size());
        assertEquals(2, saved.encryptionVersion());
        assertTrue(saved.filename().endsWith(".png"), "extension is kept, lower-cased");

        String blob = Files.readString(store.directory().resolve(saved.filename()));
        assertTrue(blob.startsWith("v2:"), "blob must be current format");

        ImageContent content = store.content(saved.id());
        assertArrayEquals(PNG, content.bytes());
        assertEquals("image/png", content.mimeType());
        assertEquals(List.of(saved), store.list());
    }

    @Test
    void legacyBlobIsServedThroughSmartDecrypt() throws Exception {
        String base64 = Base64.getEncoder().encodeToString(PNG);
        writeBlob("old.png", CryptoFixtures.legacyEncrypt(base64, CryptoFixtures.key()));
        writeIndex(List.of(entry("img_old", "old.png", T0, null)));

        assertArrayEquals(PNG, store.content("img_old").bytes());
        assertEquals(EncryptionVersion.LEGACY, store.storedVersion("img_old"), "missing flag means legacy");
    }

    @Test
    void listIsNewestFirst() throws Exception {
        writeIndex(List.of(
                entry("img_a", "a.png", T0.minusSeconds(60), 2),
                entry("img_b", "b.png", T0, 2)));

        assertEquals(List.of("img_b", "img_a"), store.list().stream().map(ImageMetadata::id).toList());
    }

    // ── Inconsistent state ───────────────────────────────────────────────────

    @Test
    void entryWithMissingBlobStillListsButContentIsNotFound() throws Exception {
        ImageMetadata one = store.save("one", PNG, "image/png", "one.png");
        ImageMetadata two = store.save("two", PNG, "image/png", "two.png");
        writeIndex(List.of(one, two, entry("img_gone", "gone.png", T0, 2)));

        List<ImageMetadata> listed = store.list();
        assertEquals(3, listed.size(), "listing reads only the index");

        RecordNotFoundException ex = assertThrows(RecordNotFoundException.class, () -> store.content("img_gone"));
        assertTrue(ex.getMessage().startsWith("Image file not found"));
        assertArrayEquals(PNG, store.content(one.id()).bytes());
    }

    @Test
    void unsafeFilenameInIndexIsNotFollowed() throws Exception {
        writeIndex(List.of(entry("img_evil", "../../secret.txt", T0, 2)));

        assertThrows(RecordNotFoundException.class, () -> store.content("img_evil"));
    }

    @Test
    void corruptIndexListsEmptyButRefusesMutation() throws Exception {
        Files.writeString(dataDir.resolve("images.json"), "[{not json", StandardCharsets.UTF_8);

        assertTrue(store.list().isEmpty());
        assertThrows(SerializationException.class, () -> store.save("x", PNG, "image/png", "x.png"));
        assertEquals("[{not json", Files.readString(dataDir.resolve("images.json")), "index must not be clobbered");
        try (var files = Files.list(store.directory())) {
            assertEquals(0, files.count(), "blob written before the failed index update must be removed");
        }
    }

    // ── Delete / cleanup ─────────────────────────────────────────────────────

    @Test
    void failedIndexWriteOnDeleteKeepsTheBlob() {
        FailingRecordJson failingJson = new FailingRecordJson();
        VaultCrypto crypto = new VaultCrypto(CryptoFixtures::key, new AesGcmCipher(), new LegacyCbcCipher());
        ImageBlobStore fragile = new ImageBlobStore(dataDir, failingJson, crypto, Clock.fixed(T0, ZoneOffset.UTC));
        ImageMetadata saved = fragile.save("kept", PNG, "image/png", "kept.png");

        failingJson.failWrites = true;
        assertThrows(SerializationException.class, () -> fragile.delete(saved.id()));
        failingJson.failWrites = false;

        assertEquals(saved, fragile.get(saved.id()), "entry must survive the failed delete");
        assertTrue(Files.exists(fragile.directory().resolve(saved.filename())),
                "an index entry must never be left without its blob");
        assertArrayEquals(PNG, fragile.content(saved.id()).bytes());
    }

    @Test
    void cleanupDuringSaveNeverLeavesADanglingEntry() {
        VaultCrypto crypto = new VaultCrypto(CryptoFixtures::key, new AesGcmCipher(), new LegacyCbcCipher());
        ImageBlobStore[] holder = new ImageBlobStore[1];
        Clock cleaningClock = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                holder[0].cleanup();
                return T0;
            }
        };
        holder[0] = new ImageBlobStore(dataDir, json, crypto, cleaningClock);

        ImageMetadata saved = holder[0].save("racing", PNG, "image/png", "racing.png");

        assertTrue(Files.exists(holder[0].directory().resolve(saved.filename())));
        assertArrayEquals(PNG, holder[0].content(saved.id()).bytes(),
                "an image save just returned must be readable");
    }

    @Test
    void deleteRemovesBlobAndEntry() {
        ImageMetadata saved = store.save("bye", PNG, "image/png", "bye.png");

        store.delete(saved.id());

        assertFalse(Files.exists(store.directory().resolve(saved.filename())));
        assertTrue(store.list().isEmpty());
        assertThrows(RecordNotFoundException.class, () -> store.delete(saved.id()));
    }

    @Test
    void cleanupRemovesEverything() throws Exception {
        store.save("a", PNG, "image/png", "a.png");
        store.save("b", PNG, "image/png", "b.png");
        Files.writeString(store.directory().resolve(".DS_Store"), "finder");

        CleanupStatus before = store.cleanupStatus();
        assertEquals(2, before.fileCount(), ".DS_Store is not counted");
        assertEquals(2, before.metadataCount());
        assertTrue(before.hasData());

        CleanupReport report = store.cleanup();

        assertTrue(report.success());
        assertEquals(2, report.deletedFiles());
        assertEquals(1, report.deletedMetadata());
        assertTrue(report.errors().isEmpty());
        assertFalse(store.cleanupStatus().hasData());
        assertEquals("[ ]", Files.readString(store.indexFile()).strip());
    }

    // ── Migration seam ───────────────────────────────────────────────────────

    @Test
    void replaceBlobFlipsFlagAndTouchesLastModified() throws Exception {
        ImageMetadata old = entry("img_old", "old.png", T0.minusSeconds(3600), 1);
        writeBlob("old.png", CryptoFixtures.legacyEncrypt("AAAA", CryptoFixtures.key()));
        writeIndex(List.of(old));

        store.replaceBlob("img_old", new AesGcmCipher().encrypt("AAAA", CryptoFixtures.key()));

        ImageMetadata updated = store.get("img_old");
        assertEquals(2, updated.encryptionVersion());
        assertEquals(T0, updated.lastModified());
        assertEquals(old.created(), updated.created());
        assertTrue(store.readBlob("img_old").startsWith("v2:"));
    }

    @Test
    void generatedFilenamesDropUnsafeExtensions() {
        assertTrue(ImageBlobStore.generateFilename("x.jpeg").endsWith(".jpeg"));
        assertFalse(ImageBlobStore.generateFilename("x.j/../peg").contains("/"));
        assertFalse(ImageBlobStore.generateFilename(null).contains("."));
    }

    /** Index writes fail on demand. */
    private static final class FailingRecordJson extends RecordJson {

        boolean failWrites;

        @Override
        public String writePretty(Object value) {
            if (failWrites) {
                throw new SerializationException("Index write refused", null);
            }
            return super.writePretty(value);
        }
    }
}
