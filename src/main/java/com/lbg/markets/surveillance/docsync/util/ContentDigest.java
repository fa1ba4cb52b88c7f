package com.lbg.markets.surveillance.docsync.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Utility for content addressing.
 * A digest is the lowercase hex SHA-256 of the bytes, so equal content shares one address.
 */
public final class ContentDigest {

    private static final int SHORT_LENGTH = 10;

    private ContentDigest() {
        // Utility class
    }

    public static String of(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    public static String of(String text) {
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Abbreviated form for log lines and identifiers shown to users.
     */
    public static String shortForm(String digest) {
        return digest.length() <= SHORT_LENGTH ? digest : digest.substring(0, SHORT_LENGTH);
    }

    public static boolean isValid(String digest) {
        if (digest == null || digest.length() != 64) {
            return false;
        }
        for (int i = 0; i < digest.length(); i++) {
            if (Character.digit(digest.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
