package com.temenos.store;

import java.security.SecureRandom;
import java.util.regex.Pattern;

import com.temenos.error.InvalidRequestException;

/**
 * Record identifiers: {@code <prefix>_<epochMillis>_<9 base36 chars>}.
 * Ids double as file names, so anything outside {@code [A-Za-z0-9_-]} is refused.
 */
public final class RecordIds {

    private static final Pattern VALID_ID = Pattern.compile("^[A-Za-z0-9_-]{1,128}$");
    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int RANDOM_CHARS = 9;
    private static final SecureRandom RANDOM = new SecureRandom();

    private RecordIds() {}

    public static String next(String prefix) {
        StringBuilder id = new StringBuilder(prefix)
                .append('_')
                .append(System.currentTimeMillis())
                .append('_');
        for (int i = 0; i < RANDOM_CHARS; i++) {
            id.append(BASE36[RANDOM.nextInt(BASE36.length)]);
        }
        return id.toString();
    }

    public static boolean isValid(String id) {
        return id != null && VALID_ID.matcher(id).matches();
    }

    public static String requireValid(String id) {
        if (!isValid(id)) {
            throw new InvalidRequestException("Invalid record id");
        }
        return id;
    }
}
