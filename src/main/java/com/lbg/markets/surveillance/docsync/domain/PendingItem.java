package com.lbg.markets.surveillance.docsync.domain;

/**
 * Remote content whose metadata has replicated but whose bytes are not local yet.
 */
public record PendingItem(
        String contentDigest,
        String logicalKey,
        long sizeBytes,
        String datasetName
) {
    public PendingItem {
        if (contentDigest == null || contentDigest.isBlank()) {
            throw new IllegalArgumentException("contentDigest cannot be blank");
        }
        if (logicalKey == null) {
            throw new IllegalArgumentException("logicalKey cannot be null");
        }
        if (sizeBytes <= 0) {
            throw new IllegalArgumentException("sizeBytes must be positive");
        }
    }
}
