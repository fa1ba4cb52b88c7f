package com.lbg.markets.surveillance.docsync.store;

import java.io.IOException;

/**
 * Content-addressed byte store shared by all datasets of a node.
 */
public interface ContentStore {

    /**
     * Store bytes and return their digest. Storing identical bytes twice is a no-op.
     */
    String put(byte[] content) throws IOException;

    /**
     * @throws ContentNotFoundException if the digest is not available locally
     */
    byte[] resolve(String contentDigest) throws IOException;

    boolean contains(String contentDigest);
}
