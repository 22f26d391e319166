package com.temenos.crypto;

import java.util.Base64;

import org.junit.jupiter.api.Test;

import com.temenos.error.IntegrityException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties of the current (v2) format: self-describing prefix, fresh IV per call,
 * and authentication failures for a wrong key or any tampering.
 */
class AesGcmCipherTest {

    private final AesGcmCipher cipher = new AesGcmCipher();

    // ── Format ───────────────────────────────────────────────────────────────

    @Test
    void blobCarriesPrefixIvAndTag() {
        String blob = cipher.encrypt("hello", CryptoFixtures.key());

        assertTrue(blob.startsWith("v2:"), "v2 blobs must be prefixed");
        byte[] raw = Base64.getDecoder().decode(blob.substring(3));
        assertEquals(12 + "hello".length() + 16, raw.length, "IV(12) || ciphertext || tag(16)");
    }

    @Test
    void decryptReturnsOriginalText() {
        String plaintext = "Ünïcødé narrative ✍ with \"quotes\"";
        String blob = cipher.encrypt(plaintext, CryptoFixtures.key());

        assertEquals(plaintext, cipher.decrypt(blob, CryptoFixtures.key()));
    }

    @Test
    void emptyPlaintextIsSupported() {
        String blob = cipher.encrypt("", CryptoFixtures.key());
        assertEquals("", cipher.decrypt(blob, CryptoFixtures.key()));
    }

    @Test
    void samePlaintextGivesDifferentBlobs() {
        String a = cipher.encrypt("same", CryptoFixtures.key());
        String b = cipher.encrypt("same", CryptoFixtures.key());

        assertNotEquals(a, b, "A fresh IV must be drawn for every call");
    }

    // ── Failures ─────────────────────────────────────────────────────────────

    @Test
    void wrongKeyFailsAuthentication() {
        String blob = cipher.encrypt("secret", CryptoFixtures.key());

        assertThrows(IntegrityException.class, () -> cipher.decrypt(blob, CryptoFixtures.otherKey()),
                "Wrong key must raise an integrity error, never garbage");
    }

    @Test
    void flippedCiphertextByteFailsAuthentication() {
        String blob = cipher.encrypt("secret payload", CryptoFixtures.key());
        byte[] raw = Base64.getDecoder().decode(blob.substring(3));
        raw[14] ^= 0x01;
        String tampered = "v2:" + Base64.getEncoder().encodeToString(raw);

        assertThrows(IntegrityException.class, () -> cipher.decrypt(tampered, CryptoFixtures.key()));
    }

    @Test
    void missingPrefixOrTruncationIsRejected() {
        String blob = cipher.encrypt("secret", CryptoFixtures.key());

        assertThrows(IntegrityException.class, () -> cipher.decrypt(blob.substring(3), CryptoFixtures.key()));
        assertThrows(IntegrityException.class, () -> cipher.decrypt("v2:AAAA", CryptoFixtures.key()));
        assertThrows(IntegrityException.class, () -> cipher.decrypt("v2:%%%", CryptoFixtures.key()));
    }
}
