package com.lbg.markets.surveillance.docsync.tracker;

import com.lbg.markets.surveillance.docsync.domain.PendingItem;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pending index held in memory for the lifetime of a session.
 * Not persistent - a restarted session rebuilds it from log replay.
 */
public class InMemoryPendingIndex implements PendingIndex {

    private final Map<String, PendingItem> itemsByDigest = new ConcurrentHashMap<>();

    @Override
    public boolean addIfAbsent(PendingItem item) {
        return itemsByDigest.putIfAbsent(item.contentDigest(), item) == null;
    }

    @Override
    public Optional<PendingItem> remove(String contentDigest) {
        return Optional.ofNullable(itemsByDigest.remove(contentDigest));
    }

    @Override
    public Optional<PendingItem> find(String contentDigest) {
        return Optional.ofNullable(itemsByDigest.get(contentDigest));
    }

    @Override
    public int size() {
        return itemsByDigest.size();
    }
}
