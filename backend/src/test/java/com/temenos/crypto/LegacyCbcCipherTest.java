package com.temenos.crypto;

import org.junit.jupiter.api.Test;

import com.temenos.error.IntegrityException;

import static org.junit.jupiter.api.Assertions.*;

class LegacyCbcCipherTest {

    private final LegacyCbcCipher cipher = new LegacyCbcCipher();

    @Test
    void decryptsLegacyBlob() {
        String blob = CryptoFixtures.legacyEncrypt("{\"title\":\"old\"}", CryptoFixtures.key());

        assertEquals("{\"title\":\"old\"}", cipher.decryptLegacy(blob, CryptoFixtures.key()));
    }

    @Test
    void wrongKeyIsDetected() {
        String blob = CryptoFixtures.legacyEncrypt("{\"title\":\"a legacy record with some length\"}",
                CryptoFixtures.key());

        // padding check plus strict UTF-8; no tag exists in this format
        assertThrows(IntegrityException.class, () -> cipher.decryptLegacy(blob, CryptoFixtures.otherKey()));
    }

    @Test
    void malformedInputIsRejected() {
        assertThrows(IntegrityException.class, () -> cipher.decryptLegacy("not base64!", CryptoFixtures.key()));
        assertThrows(IntegrityException.class, () -> cipher.decryptLegacy("AAAA", CryptoFixtures.key()),
                "shorter than IV plus one block");
    }

    @Test
    void reportsLegacyVersion() {
        assertEquals(EncryptionVersion.LEGACY, cipher.version());
        assertEquals(1, cipher.version().number());
    }
}
