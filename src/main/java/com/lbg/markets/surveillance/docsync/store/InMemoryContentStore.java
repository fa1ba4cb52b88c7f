package com.lbg.markets.surveillance.docsync.store;

import com.lbg.markets.surveillance.docsync.util.ContentDigest;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory store for development/testing.
 * Not persistent - content is lost on restart.
 */
public class InMemoryContentStore implements ContentStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public String put(byte[] content) {
        String digest = ContentDigest.of(content);
        blobs.putIfAbsent(digest, content.clone());
        return digest;
    }

    @Override
    public byte[] resolve(String contentDigest) throws ContentNotFoundException {
        byte[] content = blobs.get(contentDigest);
        if (content == null) {
            throw new ContentNotFoundException(contentDigest);
        }
        return content.clone();
    }

    @Override
    public boolean contains(String contentDigest) {
        return blobs.containsKey(contentDigest);
    }

    /**
     * Drop a blob, as if it had never been fetched.
     */
    public void evict(String contentDigest) {
        blobs.remove(contentDigest);
    }
}
