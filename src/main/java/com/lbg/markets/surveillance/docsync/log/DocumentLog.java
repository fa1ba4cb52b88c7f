package com.lbg.markets.surveillance.docsync.log;

import com.lbg.markets.surveillance.docsync.domain.LogEntry;

import java.io.IOException;
import java.util.List;

/**
 * Replicated, append-only keyed document backing one dataset.
 */
public interface DocumentLog {

    String namespaceId();

    String datasetName();

    EventSubscription subscribe() throws SubscriptionException;

    /**
     * Latest revision of every key, in key order.
     */
    List<LogEntry> latestPerKey() throws IOException;

    /**
     * Store the content and write a new revision of the key as the given author.
     */
    LogEntry append(String authorId, byte[] key, byte[] content) throws IOException;

    /**
     * Issue a write ticket other nodes can use to join this document.
     */
    String share() throws IOException;
}
