package com.lbg.markets.surveillance.docsync.log;

import com.lbg.markets.surveillance.docsync.domain.DocEvent;

/**
 * Ordered event stream of one dataset document.
 */
public interface EventSubscription extends AutoCloseable {

    /**
     * Block until the next event arrives.
     *
     * @return the next event, or null once the subscription is closed
     */
    DocEvent next() throws InterruptedException;

    @Override
    void close();
}
