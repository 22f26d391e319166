package com.temenos.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single read path for stored blobs: sniff the format, dispatch to the matching cipher.
 */
public class SmartDecrypt {

    private static final Logger log = LoggerFactory.getLogger(SmartDecrypt.class);

    private final BlobDecryptor legacy;
    private final BlobDecryptor current;

    public SmartDecrypt(LegacyCbcCipher legacy, AesGcmCipher current) {
        this.legacy = legacy;
        this.current = current;
    }

    public String smartDecrypt(String blob, VaultKey key) {
        BlobDecryptor decryptor = FormatSniffer.isLegacyFormat(blob) ? legacy : current;
        log.trace("Decrypting blob as version {}", decryptor.version().number());
        return decryptor.decrypt(blob, key);
    }
}
