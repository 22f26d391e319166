package com.temenos.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.temenos.crypto.EncryptionVersion;
import com.temenos.crypto.FormatSniffer;
import com.temenos.crypto.VaultCrypto;
import com.temenos.error.RecordNotFoundException;
import com.temenos.error.VaultException;

/**
 * Keyed persistence for one entity class: {@code <dataDir>/<class>/<id>.enc}, each file holding
 * the v2 ciphertext of the record's JSON.
 *
 * <p>Writes always use the current format. Reads always go through smart decryption, so files
 * still in the legacy format stay readable until the migration job rewrites them. Each save
 * replaces the whole record; concurrent saves to one id are last-writer-wins.
 */
public class EncryptedEntityStore<T extends StoredRecord> implements MigratableStore {

    private static final Logger log = LoggerFactory.getLogger(EncryptedEntityStore.class);

    public static final String EXTENSION = ".enc";

    private static final Comparator<StoredRecord> NEWEST_FIRST = Comparator.comparing(
            StoredRecord::lastModified, Comparator.nullsLast(Comparator.reverseOrder()));

    private final EntityClass entityClass;
    private final Path directory;
    private final Class<T> type;
    private final RecordJson json;
    private final VaultCrypto crypto;
    private final Clock clock;
    private final RecordCache<T> cache = new RecordCache<>();

    public EncryptedEntityStore(EntityClass entityClass, Path dataDir, Class<T> type,
                                RecordJson json, VaultCrypto crypto, Clock clock) {
        this.entityClass = entityClass;
        this.directory = dataDir.resolve(entityClass.pathName());
        this.type = type;
        this.json = json;
        this.crypto = crypto;
        this.clock = clock;
    }

    @Override
    public EntityClass entityClass() {
        return entityClass;
    }

    public Path directory() {
        return directory;
    }

    /**
     * All readable records, newest {@code lastModified} first. A file that cannot be read,
     * decrypted or parsed is logged and left out; it never fails the listing.
     */
    public List<T> list() {
        crypto.requireKey();
        return cache.get(this::loadAll);
    }

    public T get(String id) {
        return find(id).orElseThrow(() -> new RecordNotFoundException(entityClass.pathName(), id));
    }

    /**
     * @return empty when no file exists for the id; decrypt and parse failures still propagate
     */
    public Optional<T> find(String id) {
        crypto.requireKey();
        Path file = fileFor(RecordIds.requireValid(id));
        String blob;
        try {
            blob = BlobFiles.read(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file.getFileName(), e);
        }
        return Optional.of(json.read(crypto.smartDecrypt(blob), type));
    }

    /**
     * Creates a record when {@code id} is null or blank, otherwise replaces the record with that id.
     * The previous version, when present, supplies {@code created}; {@code lastModified} always
     * moves strictly forward.
     */
    public T save(String id, RecordWriter<T> writer) {
        crypto.requireKey();
        boolean isNew = id == null || id.isBlank();
        String recordId = isNew ? RecordIds.next(entityClass.idPrefix()) : RecordIds.requireValid(id);
        Optional<T> previous = isNew ? Optional.empty() : find(recordId);

        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant previousModified = previous.map(StoredRecord::lastModified).orElse(null);
        if (previousModified != null && !now.isAfter(previousModified)) {
            now = previousModified.plusMillis(1);
        }
        Instant created = previous.map(StoredRecord::created).filter(Objects::nonNull).orElse(now);

        T record = writer.write(recordId, created, now, previous);
        if (!recordId.equals(record.id())) {
            throw new IllegalStateException("Record writer changed the id of " + recordId);
        }

        BlobFiles.writeAtomically(fileFor(recordId), crypto.encrypt(json.write(record)));
        cache.invalidate();
        log.debug("Saved {} record {} ({})", entityClass.pathName(), recordId, previous.isPresent() ? "update" : "create");
        return record;
    }

    public void delete(String id) {
        Path file = fileFor(RecordIds.requireValid(id));
        if (!BlobFiles.delete(file)) {
            throw new RecordNotFoundException(entityClass.pathName(), id);
        }
        cache.invalidate();
        log.debug("Deleted {} record {}", entityClass.pathName(), id);
    }

    public void invalidate() {
        cache.invalidate();
    }

    // ── Migration seam ───────────────────────────────────────────────────────

    @Override
    public List<String> recordIds() {
        BlobFiles.ensureDirectory(directory);
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .filter(RecordIds::isValid)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
    }

    /** Entity files carry their version inside the blob, so it is sniffed from the file. */
    @Override
    public EncryptionVersion storedVersion(String id) {
        return FormatSniffer.detect(readBlob(id));
    }

    @Override
    public String readBlob(String id) {
        Path file = fileFor(RecordIds.requireValid(id));
        try {
            return BlobFiles.read(file);
        } catch (NoSuchFileException e) {
            throw new RecordNotFoundException(entityClass.pathName(), id);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file.getFileName(), e);
        }
    }

    @Override
    public void replaceBlob(String id, String currentBlob) {
        BlobFiles.writeAtomically(fileFor(RecordIds.requireValid(id)), currentBlob);
        cache.invalidate();
    }

    @Override
    public void markCurrent(String id) {
        // version lives inside the blob
    }

    private List<T> loadAll() {
        List<T> records = new ArrayList<>();
        for (String id : recordIds()) {
            try {
                T record = json.read(crypto.smartDecrypt(readBlob(id)), type);
                if (record.isComplete()) {
                    records.add(record);
                } else {
                    log.warn("Skipping incomplete {} record {}", entityClass.pathName(), id);
                }
            } catch (VaultException | UncheckedIOException e) {
                log.warn("Skipping unreadable {} record {}: {}", entityClass.pathName(), id, e.getMessage());
            }
        }
        records.sort(NEWEST_FIRST);
        return records;
    }

    private Path fileFor(String id) {
        return directory.resolve(id + EXTENSION);
    }
}
