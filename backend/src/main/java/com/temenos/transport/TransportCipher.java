package com.temenos.transport;

import java.util.function.Supplier;

import com.temenos.crypto.AesGcmCipher;
import com.temenos.crypto.VaultKey;

/**
 * The v2 format keyed with the transport key shared with the calling client.
 * Sealed values live only for one request/response exchange and are never written to disk.
 */
public class TransportCipher {

    private final Supplier<VaultKey> key;
    private final AesGcmCipher cipher;

    public TransportCipher(Supplier<VaultKey> key, AesGcmCipher cipher) {
        this.key = key;
        this.cipher = cipher;
    }

    public String seal(String plaintext) {
        return cipher.encrypt(plaintext, key.get());
    }

    /** @throws com.temenos.error.IntegrityException if the value was not sealed with the transport key */
    public String open(String sealed) {
        return cipher.decrypt(sealed, key.get());
    }

    public void requireKey() {
        key.get();
    }
}
