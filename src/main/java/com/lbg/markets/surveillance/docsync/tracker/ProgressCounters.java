package com.lbg.markets.surveillance.docsync.tracker;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Backlog counters for one session.
 * Lifetime counters only grow; queue counters track what is still outstanding.
 */
public class ProgressCounters {

    private final AtomicLong lifetimePendingCount = new AtomicLong();
    private final AtomicLong lifetimePendingBytes = new AtomicLong();
    private final AtomicLong queuePendingCount = new AtomicLong();
    private final AtomicLong queuePendingBytes = new AtomicLong();

    /**
     * Account for a newly pending item.
     */
    public void recordPending(long sizeBytes) {
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
        lifetimePendingCount.incrementAndGet();
        lifetimePendingBytes.addAndGet(sizeBytes);
        queuePendingCount.incrementAndGet();
        queuePendingBytes.addAndGet(sizeBytes);
    }

    /**
     * Account for a pending item that became available.
     */
    public void recordMaterialized(long sizeBytes) {
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
        queuePendingCount.decrementAndGet();
        queuePendingBytes.addAndGet(-sizeBytes);
    }

    public long lifetimePendingCount() {
        return lifetimePendingCount.get();
    }

    public long lifetimePendingBytes() {
        return lifetimePendingBytes.get();
    }

    public long queuePendingCount() {
        return queuePendingCount.get();
    }

    public long queuePendingBytes() {
        return queuePendingBytes.get();
    }
}
