package com.lbg.markets.surveillance.docsync.domain;

/**
 * Point-in-time view of a session's progress, for status displays.
 */
public record ProgressSnapshot(
        String datasetName,
        long lifetimePendingCount,
        long lifetimePendingBytes,
        long queuePendingCount,
        long queuePendingBytes,
        boolean metadataCaughtUp,
        boolean allContentMaterialized
) {
    /**
     * Fraction of the initial backlog already fetched, 1.0 when there was nothing to fetch.
     */
    public double completedRatio() {
        if (lifetimePendingBytes == 0) {
            return 1.0;
        }
        return (double) (lifetimePendingBytes - queuePendingBytes) / lifetimePendingBytes;
    }
}
