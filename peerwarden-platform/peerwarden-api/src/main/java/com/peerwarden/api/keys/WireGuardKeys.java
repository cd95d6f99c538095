package com.peerwarden.api.keys;

import java.util.Base64;
import java.util.regex.Pattern;

/**
 * WireGuard key format helpers.
 * 
 * Every WireGuard key (private, public or preshared) is 32 bytes encoded as
 * 44 characters of standard base64 ending in a single {@code =}.
 */
public final class WireGuardKeys {

    public static final int KEY_BYTES = 32;
    public static final int ENCODED_LENGTH = 44;

    private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9+/]{43}=$");

    private WireGuardKeys() {}

    /**
     * True iff {@code key} is a string in WireGuard key format.
     */
    public static boolean isValid(Object key) {
        if (!(key instanceof String str)) {
            return false;
        }
        return str.length() == ENCODED_LENGTH && KEY_PATTERN.matcher(str).matches();
    }

    public static String encode(byte[] raw) {
        if (raw == null || raw.length != KEY_BYTES) {
            throw new IllegalArgumentException("WireGuard keys are " + KEY_BYTES + " bytes");
        }
        return Base64.getEncoder().encodeToString(raw);
    }

    public static byte[] decode(String key) {
        if (!isValid(key)) {
            throw new IllegalArgumentException("Not a WireGuard key");
        }
        return Base64.getDecoder().decode(key);
    }

    /**
     * Log-safe prefix of a key.
     */
    public static String redact(String key) {
        if (key == null) {
            return "null";
        }
        return key.length() <= 8 ? "..." : key.substring(0, 8) + "...";
    }
}
