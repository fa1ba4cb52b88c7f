package com.lbg.markets.surveillance.docsync.store;

import java.io.IOException;

public class ContentNotFoundException extends IOException {

    private final String contentDigest;

    public ContentNotFoundException(String contentDigest) {
        super("Content not found: " + contentDigest);
        this.contentDigest = contentDigest;
    }

    public String contentDigest() {
        return contentDigest;
    }
}
