package com.lbg.markets.surveillance.docsync.entity;

public class SizeLimitExceededException extends IllegalArgumentException {

    private final long sizeBytes;
    private final long maxBytes;

    public SizeLimitExceededException(long sizeBytes, long maxBytes) {
        super("Entity size " + sizeBytes + " exceeds limit of " + maxBytes + " bytes");
        this.sizeBytes = sizeBytes;
        this.maxBytes = maxBytes;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public long maxBytes() {
        return maxBytes;
    }
}
