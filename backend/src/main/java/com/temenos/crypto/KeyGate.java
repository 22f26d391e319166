package com.temenos.crypto;

import java.util.regex.Pattern;

import org.bouncycastle.util.encoders.Hex;

import com.temenos.error.ConfigException;

/**
 * Format gate for secret keys. A key is exactly 64 hex characters (32 bytes, AES-256).
 * Nothing shorter, longer or derived is accepted.
 */
public final class KeyGate {

    public static final int KEY_BYTES = 32;

    private static final Pattern HEX_KEY = Pattern.compile("^[0-9a-fA-F]{" + (KEY_BYTES * 2) + "}$");

    private KeyGate() {}

    public static boolean validate(String rawKey) {
        return rawKey != null && HEX_KEY.matcher(rawKey).matches();
    }

    /**
     * Validates and decodes a key.
     *
     * @param label human readable key name used in the error message, e.g. "at-rest"
     * @throws ConfigException distinguishing an absent key from a malformed one
     */
    public static VaultKey require(String label, String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            throw new ConfigException("Encryption key not configured (" + label + ")");
        }
        if (!validate(rawKey)) {
            throw new ConfigException("Invalid encryption key format (" + label + ")");
        }
        return new VaultKey(label, Hex.decode(rawKey));
    }
}
