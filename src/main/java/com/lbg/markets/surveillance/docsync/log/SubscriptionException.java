package com.lbg.markets.surveillance.docsync.log;

import java.io.IOException;

/**
 * The document log could not establish an event subscription.
 */
public class SubscriptionException extends IOException {

    public SubscriptionException(String message) {
        super(message);
    }

    public SubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
