package com.temenos.transport;

import org.junit.jupiter.api.Test;

import com.temenos.crypto.AesGcmCipher;
import com.temenos.crypto.CryptoFixtures;
import com.temenos.crypto.LegacyCbcCipher;
import com.temenos.crypto.VaultCrypto;
import com.temenos.error.IntegrityException;

import static org.junit.jupiter.api.Assertions.*;

class TransportCipherTest {

    private final AesGcmCipher cipher = new AesGcmCipher();
    private final TransportCipher transport = new TransportCipher(CryptoFixtures::otherKey, cipher);

    @Test
    void sealedValueOpensWithTransportKey() {
        String sealed = transport.seal("a prompt from the client");

        assertTrue(sealed.startsWith("v2:"), "transport uses the current format");
        assertEquals("a prompt from the client", transport.open(sealed));
    }

    @Test
    void atRestAndTransportKeysDoNotCrossOver() {
        VaultCrypto atRest = new VaultCrypto(CryptoFixtures::key, cipher, new LegacyCbcCipher());

        String storedBlob = atRest.encrypt("stored");
        String sealed = transport.seal("in flight");

        assertThrows(IntegrityException.class, () -> transport.open(storedBlob));
        assertThrows(IntegrityException.class, () -> atRest.smartDecrypt(sealed));
    }
}
