package com.lbg.markets.surveillance.docsync.tracker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProgressCountersTest {

    @Test
    void shouldGrowLifetimeAndShrinkQueue() {
        ProgressCounters counters = new ProgressCounters();

        counters.recordPending(100);
        counters.recordPending(50);
        counters.recordMaterialized(100);

        assertEquals(2, counters.lifetimePendingCount());
        assertEquals(150, counters.lifetimePendingBytes());
        assertEquals(1, counters.queuePendingCount());
        assertEquals(50, counters.queuePendingBytes());
    }

    @Test
    void shouldRejectNegativeSizes() {
        ProgressCounters counters = new ProgressCounters();

        assertThrows(IllegalArgumentException.class, () -> counters.recordPending(-1));
        assertThrows(IllegalArgumentException.class, () -> counters.recordMaterialized(-1));
        assertEquals(0, counters.lifetimePendingCount());
    }
}
