package com.temenos.crypto;

/**
 * One concrete at-rest format. {@link SmartDecrypt} picks the implementation;
 * callers outside this package never choose one themselves.
 */
public interface BlobDecryptor {

    EncryptionVersion version();

    /**
     * @throws com.temenos.error.IntegrityException when the key is wrong or the blob is damaged
     */
    String decrypt(String blob, VaultKey key);
}
