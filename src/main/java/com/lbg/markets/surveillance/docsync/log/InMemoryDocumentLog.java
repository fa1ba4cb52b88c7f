package com.lbg.markets.surveillance.docsync.log;

import com.lbg.markets.surveillance.docsync.domain.DocEvent;
import com.lbg.markets.surveillance.docsync.domain.LogEntry;
import com.lbg.markets.surveillance.docsync.store.ContentStore;
import com.lbg.markets.surveillance.docsync.util.DocTicket;
import com.lbg.markets.surveillance.docsync.util.Keys;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Document held in memory. Local writes and simulated replication both fan out
 * to every open subscription in publish order.
 */
public class InMemoryDocumentLog implements DocumentLog {

    private static final Logger LOG = Logger.getLogger(InMemoryDocumentLog.class);

    private final String namespaceId;
    private final String datasetName;
    private final String nodeId;
    private final ContentStore contentStore;

    // keyed by hex of the raw key so ordering follows the key bytes
    private final Map<String, LogEntry> latestByKey = new ConcurrentSkipListMap<>();
    private final List<QueueSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public InMemoryDocumentLog(String namespaceId, String datasetName, String nodeId, ContentStore contentStore) {
        this.namespaceId = namespaceId;
        this.datasetName = datasetName;
        this.nodeId = nodeId;
        this.contentStore = contentStore;
    }

    @Override
    public String namespaceId() {
        return namespaceId;
    }

    @Override
    public String datasetName() {
        return datasetName;
    }

    @Override
    public EventSubscription subscribe() throws SubscriptionException {
        if (closed) {
            throw new SubscriptionException("Document " + namespaceId + " is closed");
        }
        QueueSubscription subscription = new QueueSubscription();
        subscriptions.add(subscription);
        return subscription;
    }

    @Override
    public List<LogEntry> latestPerKey() {
        return List.copyOf(latestByKey.values());
    }

    @Override
    public LogEntry append(String authorId, byte[] key, byte[] content) throws IOException {
        String digest = contentStore.put(content);
        LogEntry entry = new LogEntry(key, digest, content.length, authorId, System.currentTimeMillis());
        latestByKey.put(HexFormat.of().formatHex(key), entry);
        publish(new DocEvent.LocalInsert(entry));
        return entry;
    }

    @Override
    public String share() {
        return new DocTicket(namespaceId, nodeId).toString();
    }

    /**
     * Record an entry written by a peer. Only metadata is applied; the bytes follow
     * separately through {@link #contentArrived(byte[])}.
     * A key that is not valid UTF-8 is still recorded but announces no remote insert.
     */
    public LogEntry receiveRemote(String peerId, byte[] key, String contentDigest, long contentSize) {
        LogEntry entry = new LogEntry(key, contentDigest, contentSize, peerId, System.currentTimeMillis());
        latestByKey.put(HexFormat.of().formatHex(key), entry);

        String logicalKey;
        try {
            logicalKey = Keys.decode(key);
        } catch (CharacterCodingException e) {
            LOG.warnf("Remote entry from %s in %s has a key that is not valid UTF-8, not announced",
                    peerId, namespaceId);
            return entry;
        }
        publish(new DocEvent.RemoteInsert(contentDigest, contentSize, logicalKey, datasetName, peerId));
        return entry;
    }

    /**
     * Store fetched bytes and announce them as ready.
     */
    public String contentArrived(byte[] content) throws IOException {
        String digest = contentStore.put(content);
        publish(new DocEvent.ContentReady(digest));
        return digest;
    }

    public void publish(DocEvent event) {
        for (QueueSubscription subscription : subscriptions) {
            subscription.offer(event);
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    /**
     * End every open subscription and refuse new ones.
     */
    public void close() {
        closed = true;
        for (QueueSubscription subscription : subscriptions) {
            subscription.close();
        }
        LOG.debugf("Closed doc %s", namespaceId);
    }

    private final class QueueSubscription implements EventSubscription {

        private final BlockingQueue<Object> events = new LinkedBlockingQueue<>();
        private final Object endOfStream = new Object();

        void offer(DocEvent event) {
            events.add(event);
        }

        @Override
        public DocEvent next() throws InterruptedException {
            Object next = events.take();
            if (next == endOfStream) {
                // keep the marker so repeated calls keep returning null
                events.add(endOfStream);
                return null;
            }
            return (DocEvent) next;
        }

        @Override
        public void close() {
            if (subscriptions.remove(this)) {
                events.add(endOfStream);
            }
        }
    }
}
