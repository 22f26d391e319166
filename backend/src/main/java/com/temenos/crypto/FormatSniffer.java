package com.temenos.crypto;

import java.util.regex.Pattern;

/**
 * Classifies a blob by shape alone. Needs no key and never decrypts.
 * Anything that is not clearly legacy is reported as current, so the v2 path
 * gets the first try and produces the error for foreign input.
 */
public final class FormatSniffer {

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]+={0,2}$");
    private static final int LEGACY_BLOCK = 16;

    private FormatSniffer() {}

    public static boolean isLegacyFormat(String blob) {
        if (blob == null) {
            return false;
        }
        String s = blob.strip();
        if (s.startsWith(AesGcmCipher.PREFIX) || s.length() % 4 != 0 || !BASE64.matcher(s).matches()) {
            return false;
        }
        int padding = s.endsWith("==") ? 2 : s.endsWith("=") ? 1 : 0;
        int decodedLength = s.length() / 4 * 3 - padding;
        // IV block plus at least one cipher block, block aligned
        return decodedLength >= LEGACY_BLOCK * 2 && decodedLength % LEGACY_BLOCK == 0;
    }

    public static EncryptionVersion detect(String blob) {
        return isLegacyFormat(blob) ? EncryptionVersion.LEGACY : EncryptionVersion.CURRENT;
    }
}
