package com.lbg.markets.surveillance.docsync.util;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Parsing and generation of 32-byte node secret keys.
 * Accepts either an array form {@code [1, 2, 3]} or a hex string.
 */
public final class SecretKeys {

    public static final int KEY_LENGTH = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private SecretKeys() {
        // Utility class
    }

    public static byte[] parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Secret key cannot be blank");
        }
        String trimmed = text.trim();
        byte[] key = trimmed.startsWith("[") && trimmed.endsWith("]")
                ? parseArray(trimmed.substring(1, trimmed.length() - 1))
                : parseHex(trimmed);
        if (key.length != KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "Invalid secret key length (expected " + KEY_LENGTH + " bytes, got " + key.length + ")");
        }
        return key;
    }

    public static byte[] generate() {
        byte[] key = new byte[KEY_LENGTH];
        RANDOM.nextBytes(key);
        return key;
    }

    /**
     * Stable public identifier for the node owning this key.
     */
    public static String nodeId(byte[] secretKey) {
        return ContentDigest.shortForm(ContentDigest.of(secretKey));
    }

    private static byte[] parseArray(String inner) {
        String[] parts = inner.split(",");
        byte[] out = new byte[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].trim();
            try {
                int value = Integer.parseInt(part);
                if (value < 0 || value > 255) {
                    throw new IllegalArgumentException("Invalid number '" + part + "': out of byte range");
                }
                out[i] = (byte) value;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number '" + part + "'", e);
            }
        }
        return out;
    }

    private static byte[] parseHex(String hex) {
        if (hex.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex string must have even length");
        }
        return HexFormat.of().parseHex(hex);
    }
}
