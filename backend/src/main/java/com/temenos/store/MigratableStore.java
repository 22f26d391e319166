package com.temenos.store;

import java.util.List;

import com.temenos.crypto.EncryptionVersion;

/**
 * What the migration job needs from a store. Implementations keep ownership of their files;
 * the job only reads and replaces blobs through these calls.
 */
public interface MigratableStore {

    EntityClass entityClass();

    List<String> recordIds();

    /** The version the store believes the record is at, without decrypting it. */
    EncryptionVersion storedVersion(String id);

    /** @throws com.temenos.error.RecordNotFoundException when the blob file is missing */
    String readBlob(String id);

    /** Overwrites the blob with a migrated v2 blob and flips any stored version flag. */
    void replaceBlob(String id, String currentBlob);

    /** Records that an already-v2 blob is current, for stores that keep a separate flag. */
    void markCurrent(String id);
}
