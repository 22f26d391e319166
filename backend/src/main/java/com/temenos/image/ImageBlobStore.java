package com.temenos.image;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.temenos.crypto.EncryptionVersion;
import com.temenos.crypto.VaultCrypto;
import com.temenos.error.RecordNotFoundException;
import com.temenos.error.SerializationException;
import com.temenos.store.BlobFiles;
import com.temenos.store.EntityClass;
import com.temenos.store.MigratableStore;
import com.temenos.store.RecordIds;
import com.temenos.store.RecordJson;

/**
 * Encrypted image storage: one blob per image under {@code <dataDir>/images/} holding the
 * v2 ciphertext of the base64 image bytes, plus a single plaintext index {@code <dataDir>/images.json}.
 *
 * <p>Listing reads only the index. A blob is always written before its index entry, and is
 * removed again if the index write fails, so this store never leaves an entry pointing at a
 * missing file. Entries or files orphaned by outside causes are tolerated on read.
 *
 * <p>The index is rewritten whole on every mutation. Mutations inside this process are serialized
 * by {@link #indexLock}; writers in other processes can still lose each other's updates.
 */
public class ImageBlobStore implements MigratableStore {

    private static final Logger log = LoggerFactory.getLogger(ImageBlobStore.class);

    public static final String INDEX_FILE = "images.json";

    private static final TypeReference<List<ImageMetadata>> INDEX_TYPE = new TypeReference<>() {};
    private static final Pattern SAFE_FILENAME = Pattern.compile("^[A-Za-z0-9_-][A-Za-z0-9._-]{0,127}$");
    private static final Pattern SAFE_EXTENSION = Pattern.compile("^\\.[A-Za-z0-9]{1,10}$");
    private static final String IGNORED_FILE = ".DS_Store";
    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Path directory;
    private final Path indexFile;
    private final RecordJson json;
    private final VaultCrypto crypto;
    private final Clock clock;
    private final ReentrantLock indexLock = new ReentrantLock();

    public ImageBlobStore(Path dataDir, RecordJson json, VaultCrypto crypto, Clock clock) {
        this.directory = dataDir.resolve(EntityClass.IMAGES.pathName());
        this.indexFile = dataDir.resolve(INDEX_FILE);
        this.json = json;
        this.crypto = crypto;
        this.clock = clock;
    }

    @Override
    public EntityClass entityClass() {
        return EntityClass.IMAGES;
    }

    public Path directory() {
        return directory;
    }

    public Path indexFile() {
        return indexFile;
    }

    /** Newest first, straight from the index. Nothing is decrypted. */
    public List<ImageMetadata> list() {
        List<ImageMetadata> entries = new ArrayList<>(readIndexLenient());
        entries.sort(Comparator.comparing(ImageMetadata::created, Comparator.nullsLast(Comparator.reverseOrder())));
        return entries;
    }

    public ImageMetadata get(String id) {
        return findEntry(readIndexLenient(), id)
                .orElseThrow(() -> new RecordNotFoundException(EntityClass.IMAGES.pathName(), id));
    }

    public ImageContent content(String id) {
        ImageMetadata entry = get(id);
        String base64 = crypto.smartDecrypt(readBlobFile(entry));
        try {
            return new ImageContent(Base64.getDecoder().decode(base64.strip()), entry.mimeType());
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Image " + id + " does not hold base64 data", e);
        }
    }

    public ImageMetadata save(String title, byte[] bytes, String mimeType, String originalName) {
        crypto.requireKey();
        String id = RecordIds.next(EntityClass.IMAGES.idPrefix());
        String filename = generateFilename(originalName);
        Path blobFile = directory.resolve(filename);
        String blob = crypto.encrypt(Base64.getEncoder().encodeToString(bytes));

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        ImageMetadata entry = new ImageMetadata(id, title.trim(), filename, now, now, bytes.length, mimeType,
                EncryptionVersion.CURRENT.number());

        // blob and entry land under one lock so cleanup cannot fall between them
        indexLock.lock();
        try {
            BlobFiles.writeAtomically(blobFile, blob);
            try {
                List<ImageMetadata> entries = readIndexStrict();
                entries.add(entry);
                writeIndex(entries);
            } catch (RuntimeException e) {
                BlobFiles.delete(blobFile);
                throw e;
            }
        } finally {
            indexLock.unlock();
        }
        log.debug("Stored image {} ({} bytes)", id, bytes.length);
        return entry;
    }

    /** Drops the index entry first; a blob left behind by a failed file delete is only an orphan. */
    public void delete(String id) {
        indexLock.lock();
        try {
            List<ImageMetadata> entries = readIndexStrict();
            ImageMetadata entry = findEntry(entries, id)
                    .orElseThrow(() -> new RecordNotFoundException(EntityClass.IMAGES.pathName(), id));
            entries.remove(entry);
            writeIndex(entries);
            if (entry.filename() != null && SAFE_FILENAME.matcher(entry.filename()).matches()) {
                try {
                    BlobFiles.delete(directory.resolve(entry.filename()));
                } catch (UncheckedIOException e) {
                    log.warn("Image {} removed from index but its file remains: {}", id, e.getMessage());
                }
            }
        } finally {
            indexLock.unlock();
        }
        log.debug("Deleted image {}", id);
    }

    /** Removes every blob and resets the index to an empty array. */
    public CleanupReport cleanup() {
        int deletedFiles = 0;
        int deletedMetadata = 0;
        List<String> errors = new ArrayList<>();

        indexLock.lock();
        try {
            if (Files.isDirectory(directory)) {
                for (Path file : listDirectory(errors)) {
                    try {
                        Files.deleteIfExists(file);
                        deletedFiles++;
                    } catch (IOException e) {
                        errors.add("Failed to delete file " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            }
            try {
                writeIndex(new ArrayList<>());
                deletedMetadata = 1;
            } catch (UncheckedIOException | SerializationException e) {
                errors.add("Failed to reset metadata: " + e.getMessage());
            }
        } finally {
            indexLock.unlock();
        }
        log.info("Image cleanup removed {} files, {} errors", deletedFiles, errors.size());
        return new CleanupReport(true, deletedFiles, deletedMetadata, errors.stream().limit(10).toList());
    }

    public CleanupStatus cleanupStatus() {
        int fileCount = Files.isDirectory(directory) ? listDirectory(new ArrayList<>()).size() : 0;
        int metadataCount = readIndexLenient().size();
        return new CleanupStatus(fileCount, metadataCount, fileCount > 0 || metadataCount > 0);
    }

    // ── Migration seam ───────────────────────────────────────────────────────

    @Override
    public List<String> recordIds() {
        return readIndexLenient().stream().map(ImageMetadata::id).toList();
    }

    /** Images carry their version as an index flag, so no blob is read here. */
    @Override
    public EncryptionVersion storedVersion(String id) {
        return EncryptionVersion.fromFlag(get(id).encryptionVersion());
    }

    @Override
    public String readBlob(String id) {
        return readBlobFile(get(id));
    }

    @Override
    public void replaceBlob(String id, String currentBlob) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        indexLock.lock();
        try {
            BlobFiles.writeAtomically(blobPath(get(id)), currentBlob);
            updateEntry(id, e -> e.withEncryptionVersion(EncryptionVersion.CURRENT.number(), now));
        } finally {
            indexLock.unlock();
        }
    }

    @Override
    public void markCurrent(String id) {
        updateEntry(id, e -> e.withEncryptionVersion(EncryptionVersion.CURRENT.number(), e.lastModified()));
    }

    // ── Index handling ───────────────────────────────────────────────────────

    private void updateEntry(String id, UnaryOperator<ImageMetadata> change) {
        mutateIndex(entries -> {
            for (int i = 0; i < entries.size(); i++) {
                if (entries.get(i).id().equals(id)) {
                    entries.set(i, change.apply(entries.get(i)));
                    return entries;
                }
            }
            throw new RecordNotFoundException(EntityClass.IMAGES.pathName(), id);
        });
    }

    private void mutateIndex(UnaryOperator<List<ImageMetadata>> mutation) {
        indexLock.lock();
        try {
            writeIndex(mutation.apply(readIndexStrict()));
        } finally {
            indexLock.unlock();
        }
    }

    /** For reads: an unreadable index is logged and treated as empty. */
    private List<ImageMetadata> readIndexLenient() {
        try {
            return readIndexStrict();
        } catch (SerializationException | UncheckedIOException e) {
            log.error("Image index unreadable, listing as empty: {}", e.getMessage());
            return List.of();
        }
    }

    /** For mutations: an unreadable index fails the call rather than being overwritten. */
    private List<ImageMetadata> readIndexStrict() {
        String content;
        try {
            content = BlobFiles.read(indexFile);
        } catch (NoSuchFileException e) {
            return new ArrayList<>();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read image index", e);
        }
        if (content.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(json.read(content, INDEX_TYPE));
    }

    private void writeIndex(List<ImageMetadata> entries) {
        BlobFiles.writeAtomically(indexFile, json.writePretty(entries));
    }

    private static Optional<ImageMetadata> findEntry(List<ImageMetadata> entries, String id) {
        return entries.stream().filter(e -> e.id() != null && e.id().equals(id)).findFirst();
    }

    private String readBlobFile(ImageMetadata entry) {
        Path file = blobPath(entry);
        try {
            return BlobFiles.read(file);
        } catch (NoSuchFileException e) {
            throw new RecordNotFoundException(EntityClass.IMAGES.pathName(), entry.id(),
                    "Image file not found: " + entry.filename());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + entry.filename(), e);
        }
    }

    // The index is plaintext on disk, so its file names are not trusted.
    private Path blobPath(ImageMetadata entry) {
        if (entry.filename() == null || !SAFE_FILENAME.matcher(entry.filename()).matches()) {
            throw new RecordNotFoundException(EntityClass.IMAGES.pathName(), entry.id(),
                    "Image file not found: invalid file name in index");
        }
        return directory.resolve(entry.filename());
    }

    private List<Path> listDirectory(List<String> errors) {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> !IGNORED_FILE.equals(p.getFileName().toString())).toList();
        } catch (IOException e) {
            errors.add("Failed to read images directory: " + e.getMessage());
            return List.of();
        }
    }

    static String generateFilename(String originalName) {
        StringBuilder name = new StringBuilder()
                .append(System.currentTimeMillis())
                .append('_');
        for (int i = 0; i < 13; i++) {
            name.append(BASE36[RANDOM.nextInt(BASE36.length)]);
        }
        if (originalName != null) {
            int dot = originalName.lastIndexOf('.');
            if (dot >= 0) {
                String extension = originalName.substring(dot).toLowerCase(Locale.ROOT);
                if (SAFE_EXTENSION.matcher(extension).matches()) {
                    name.append(extension);
                }
            }
        }
        return name.toString();
    }
}
