package com.temenos.crypto;

import java.util.function.Supplier;

/**
 * At-rest crypto bound to the at-rest key. Stores encrypt with v2 only and read through
 * {@link SmartDecrypt}; the migration job additionally uses the explicit legacy and current paths.
 */
public class VaultCrypto {

    private final Supplier<VaultKey> key;
    private final AesGcmCipher current;
    private final LegacyCbcCipher legacy;
    private final SmartDecrypt smartDecrypt;

    public VaultCrypto(Supplier<VaultKey> key, AesGcmCipher current, LegacyCbcCipher legacy) {
        this.key = key;
        this.current = current;
        this.legacy = legacy;
        this.smartDecrypt = new SmartDecrypt(legacy, current);
    }

    public String encrypt(String plaintext) {
        return current.encrypt(plaintext, key.get());
    }

    public String smartDecrypt(String blob) {
        return smartDecrypt.smartDecrypt(blob, key.get());
    }

    public String decryptLegacy(String blob) {
        return legacy.decryptLegacy(blob, key.get());
    }

    public String decryptCurrent(String blob) {
        return current.decrypt(blob, key.get());
    }

    public boolean isLegacyFormat(String blob) {
        return FormatSniffer.isLegacyFormat(blob);
    }

    /** Resolves the key now, raising the configuration error if it is unusable. */
    public void requireKey() {
        key.get();
    }
}
