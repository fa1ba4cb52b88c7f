package com.lbg.markets.surveillance.docsync.domain;

/**
 * One revision of one key in a dataset document.
 * The key is raw bytes; it is not guaranteed to be valid text.
 */
public record LogEntry(
        byte[] key,
        String contentDigest,
        long contentSize,
        String authorId,
        long timestampMs
) {
    public LogEntry {
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("key cannot be empty");
        }
        if (contentSize < 0) {
            throw new IllegalArgumentException("contentSize cannot be negative");
        }
        key = key.clone();
    }

    @Override
    public byte[] key() {
        return key.clone();
    }
}
