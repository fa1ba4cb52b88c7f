package com.lbg.markets.surveillance.docsync.domain;

/**
 * Describes a local file discovered for loading, before it is read.
 */
public record FileDescriptor(
        String sourcePath,
        String fileName,
        long sizeBytes
) {
    public FileDescriptor {
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new IllegalArgumentException("sourcePath cannot be blank");
        }
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName cannot be blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
    }
}
