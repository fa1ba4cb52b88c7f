package com.lbg.markets.surveillance.docsync.tracker;

import com.lbg.markets.surveillance.docsync.domain.PendingItem;

import java.util.Optional;

/**
 * Index of content that is known from replicated metadata but not yet local.
 * A session's consumer is the only writer; readers may be on any thread.
 */
public interface PendingIndex {

    /**
     * Record an item unless its digest is already pending. The first writer wins.
     *
     * @return true if the item was added, false if the digest was already present
     */
    boolean addIfAbsent(PendingItem item);

    /**
     * Remove the item for a digest, if any.
     */
    Optional<PendingItem> remove(String contentDigest);

    Optional<PendingItem> find(String contentDigest);

    int size();

    default boolean isPending(String contentDigest) {
        return find(contentDigest).isPresent();
    }
}
