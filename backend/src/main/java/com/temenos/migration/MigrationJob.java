package com.temenos.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.temenos.crypto.EncryptionVersion;
import com.temenos.crypto.VaultCrypto;
import com.temenos.error.IntegrityException;
import com.temenos.error.MigrationInProgressException;
import com.temenos.error.VaultException;
import com.temenos.store.EntityClass;
import com.temenos.store.MigratableStore;

/**
 * Upgrades legacy (v1) blobs of one entity class to the current format in place.
 *
 * <p>A pass walks every record sequentially. Records already at v2 are skipped without
 * decrypting, so running the job again migrates nothing new. A failing record is counted
 * and reported but never stops the pass. Only one pass per entity class may run at a time.
 */
@Component
public class MigrationJob {

    private static final Logger log = LoggerFactory.getLogger(MigrationJob.class);

    static final int MAX_ERROR_MESSAGES = 10;

    private final VaultCrypto crypto;
    private final Set<EntityClass> running = ConcurrentHashMap.newKeySet();

    public MigrationJob(VaultCrypto crypto) {
        this.crypto = crypto;
    }

    public MigrationReport run(MigratableStore store) {
        EntityClass entityClass = store.entityClass();
        if (!running.add(entityClass)) {
            throw new MigrationInProgressException(entityClass.pathName());
        }
        try {
            // a missing key fails the whole pass, not every record one by one
            crypto.requireKey();

            List<String> ids = store.recordIds();
            List<String> errors = new ArrayList<>();
            int migrated = 0;
            int skipped = 0;
            int failed = 0;

            for (String id : ids) {
                MigrationState outcome = migrateOne(store, id, errors);
                switch (outcome) {
                    case MIGRATED -> migrated++;
                    case SKIPPED -> skipped++;
                    case ERROR -> failed++;
                    default -> throw new IllegalStateException("Unexpected final state " + outcome);
                }
            }

            log.info("Migration of {}: {} migrated, {} skipped, {} failed of {}",
                    entityClass.pathName(), migrated, skipped, failed, ids.size());
            return new MigrationReport(entityClass.pathName(), true, migrated, skipped, failed, ids.size(),
                    errors.stream().limit(MAX_ERROR_MESSAGES).toList());
        } finally {
            running.remove(entityClass);
        }
    }

    public MigrationStatus status(MigratableStore store) {
        List<String> ids = store.recordIds();
        int current = 0;
        for (String id : ids) {
            try {
                if (store.storedVersion(id) == EncryptionVersion.CURRENT) {
                    current++;
                }
            } catch (VaultException e) {
                log.debug("Counting {} record {} as legacy: {}", store.entityClass().pathName(), id, e.getMessage());
            }
        }
        int total = ids.size();
        int legacy = total - current;
        double progress = total > 0 ? current * 100.0 / total : 100.0;
        return new MigrationStatus(store.entityClass().pathName(), total, current, legacy, legacy == 0, progress);
    }

    private MigrationState migrateOne(MigratableStore store, String id, List<String> errors) {
        String entityClass = store.entityClass().pathName();
        MigrationState state = MigrationState.UNMIGRATED;
        try {
            if (store.storedVersion(id) == EncryptionVersion.CURRENT) {
                return MigrationState.SKIPPED;
            }
            String blob = store.readBlob(id);
            if (!crypto.isLegacyFormat(blob)) {
                // flag was stale; the blob is already current
                store.markCurrent(id);
                return MigrationState.SKIPPED;
            }

            state = MigrationState.MIGRATING;
            String plaintext = crypto.decryptLegacy(blob);
            String upgraded = crypto.encrypt(plaintext);
            if (!plaintext.equals(crypto.decryptCurrent(upgraded))) {
                throw new IntegrityException("Re-encrypted blob did not verify");
            }
            store.replaceBlob(id, upgraded);
            log.debug("Migrated {} record {}", entityClass, id);
            return MigrationState.MIGRATED;
        } catch (RuntimeException e) {
            errors.add("Failed to migrate " + entityClass + " record " + id + ": " + e.getMessage());
            log.warn("Migration of {} record {} failed while {}: {}", entityClass, id, state, e.getMessage());
            return MigrationState.ERROR;
        }
    }
}
