package com.lbg.markets.surveillance.docsync.entity;

import java.io.IOException;

/**
 * A log entry's key is not valid UTF-8 text.
 */
public class KeyDecodeException extends IOException {

    public KeyDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
