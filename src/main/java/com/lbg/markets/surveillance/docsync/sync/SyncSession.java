package com.lbg.markets.surveillance.docsync.sync;

import com.lbg.markets.surveillance.docsync.domain.DocEvent;
import com.lbg.markets.surveillance.docsync.domain.PendingItem;
import com.lbg.markets.surveillance.docsync.domain.ProgressSnapshot;
import com.lbg.markets.surveillance.docsync.log.EventSubscription;
import com.lbg.markets.surveillance.docsync.tracker.PendingIndex;
import com.lbg.markets.surveillance.docsync.tracker.ProgressCounters;
import com.lbg.markets.surveillance.docsync.util.ContentDigest;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks synchronization progress of one dataset.
 * <p>
 * Metadata arrives first (remote inserts), content later (content ready), and the
 * all-clear marks the end of the initial catch-up. Counters only measure that initial
 * backlog: once the all-clear is seen they freeze and the consumer task retires.
 * The pending index keeps being maintained after that.
 */
public class SyncSession implements DocEvent.Visitor {

    private static final Logger LOG = Logger.getLogger(SyncSession.class);

    private final String datasetName;
    private final String namespaceId;
    private final PendingIndex pendingIndex;
    private final Set<String> excludedDatasets;
    private final ProgressCounters counters = new ProgressCounters();
    private final BlockingQueue<String> readyKeys;

    private final AtomicBoolean metadataCaughtUp = new AtomicBoolean(false);
    private final AtomicBoolean allContentMaterialized = new AtomicBoolean(false);

    private final Object consumerLock = new Object();
    private Future<?> consumer;

    public SyncSession(
            String datasetName,
            String namespaceId,
            PendingIndex pendingIndex,
            int outletCapacity,
            Set<String> excludedDatasets
    ) {
        if (datasetName == null || datasetName.isBlank()) {
            throw new IllegalArgumentException("datasetName cannot be blank");
        }
        if (outletCapacity <= 0) {
            throw new IllegalArgumentException("outletCapacity must be positive");
        }
        this.datasetName = datasetName;
        this.namespaceId = namespaceId;
        this.pendingIndex = pendingIndex;
        this.readyKeys = new ArrayBlockingQueue<>(outletCapacity);
        this.excludedDatasets = Set.copyOf(excludedDatasets);
    }

    /**
     * Apply one event. Blocks while the ready-key outlet is full.
     */
    public void handle(DocEvent event) throws InterruptedException {
        event.accept(this);
    }

    /**
     * Consumer loop: pulls events in order until the stream ends or the task is cancelled.
     * A failing event is logged and skipped.
     */
    public void consume(EventSubscription events) {
        LOG.infof("Consumer started for %s (doc %s)", datasetName, namespaceId);
        try (events) {
            DocEvent event;
            while (!Thread.currentThread().isInterrupted() && (event = events.next()) != null) {
                try {
                    handle(event);
                } catch (RuntimeException e) {
                    LOG.errorf(e, "[%s] Failed to apply event %s", datasetName, event);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.infof("Consumer stopped for %s", datasetName);
    }

    /**
     * Hand over the cancellation handle of the task running {@link #consume}.
     * If the all-clear was already processed the task is cancelled right away.
     */
    public void attach(Future<?> consumerTask) {
        synchronized (consumerLock) {
            if (consumer != null) {
                throw new IllegalStateException("Consumer already attached for " + datasetName);
            }
            if (allContentMaterialized.get()) {
                consumerTask.cancel(true);
                return;
            }
            consumer = consumerTask;
        }
    }

    /**
     * Best-effort stop of the consumer, for teardown. Counters and flags are left as they are.
     */
    public void stop() {
        retireConsumer();
    }

    public boolean isConsumerActive() {
        synchronized (consumerLock) {
            return consumer != null && !consumer.isDone();
        }
    }

    @Override
    public void onRemoteInsert(DocEvent.RemoteInsert event) {
        if (excludedDatasets.contains(event.datasetName())) {
            return;
        }
        if (event.contentSize() == 0) {
            // tombstone: the key was deleted, nothing to fetch
            LOG.debugf("[%s] Empty entry %s from %s", datasetName, event.logicalKey(), event.peerId());
            return;
        }

        PendingItem item = new PendingItem(
                event.contentDigest(),
                event.logicalKey(),
                event.contentSize(),
                event.datasetName()
        );
        if (!pendingIndex.addIfAbsent(item)) {
            LOG.debugf("[%s] Digest %s already pending", datasetName, ContentDigest.shortForm(event.contentDigest()));
            return;
        }
        if (!allContentMaterialized.get()) {
            counters.recordPending(event.contentSize());
        }
        LOG.debugf("[%s] Remote %s pending %s (%d bytes)",
                datasetName, event.peerId(), event.logicalKey(), event.contentSize());
    }

    @Override
    public void onLocalInsert(DocEvent.LocalInsert event) {
        LOG.debugf("[%s] Local insert %s", datasetName, ContentDigest.shortForm(event.entry().contentDigest()));
    }

    @Override
    public void onContentReady(DocEvent.ContentReady event) throws InterruptedException {
        Optional<PendingItem> removed = pendingIndex.remove(event.contentDigest());
        if (removed.isEmpty()) {
            LOG.debugf("[%s] Content %s ready but not pending", datasetName, ContentDigest.shortForm(event.contentDigest()));
            return;
        }
        if (allContentMaterialized.get()) {
            return;
        }

        PendingItem item = removed.get();
        counters.recordMaterialized(item.sizeBytes());
        readyKeys.put(item.logicalKey());
        LOG.debugf("[%s] Content ready for %s", datasetName, item.logicalKey());
    }

    @Override
    public void onAllClear(DocEvent.AllClear event) {
        boolean previous = allContentMaterialized.getAndSet(true);
        LOG.infof("[%s] All remote content synced (already synced: %s)", datasetName, previous);
        if (!previous) {
            retireConsumer();
        }
    }

    @Override
    public void onPeerJoined(DocEvent.PeerJoined event) {
        LOG.infof("[%s] Peer joined %s", datasetName, event.peerId());
    }

    @Override
    public void onPeerLeft(DocEvent.PeerLeft event) {
        LOG.infof("[%s] Peer left %s", datasetName, event.peerId());
    }

    @Override
    public void onRoundComplete(DocEvent.RoundComplete event) {
        metadataCaughtUp.set(true);
        LOG.infof("[%s] Sync round complete %s", datasetName, event.info());
    }

    private void retireConsumer() {
        Future<?> task;
        synchronized (consumerLock) {
            task = consumer;
            consumer = null;
        }
        if (task != null) {
            task.cancel(true);
        }
    }

    /**
     * Wait up to the timeout for the next key whose content became available.
     *
     * @return the key, or null on timeout
     */
    public String pollReadyKey(long timeout, TimeUnit unit) throws InterruptedException {
        return readyKeys.poll(timeout, unit);
    }

    public List<String> drainReadyKeys() {
        List<String> keys = new ArrayList<>();
        readyKeys.drainTo(keys);
        return keys;
    }

    /**
     * Consistent enough for display: queue counters are read before lifetime counters,
     * and lifetime is raised first on every insert, so queue never exceeds lifetime here.
     */
    public ProgressSnapshot snapshot() {
        long queueCount = counters.queuePendingCount();
        long queueBytes = counters.queuePendingBytes();
        long lifetimeCount = counters.lifetimePendingCount();
        long lifetimeBytes = counters.lifetimePendingBytes();
        return new ProgressSnapshot(
                datasetName,
                lifetimeCount,
                lifetimeBytes,
                queueCount,
                queueBytes,
                metadataCaughtUp.get(),
                allContentMaterialized.get()
        );
    }

    public String datasetName() {
        return datasetName;
    }

    public String namespaceId() {
        return namespaceId;
    }

    public long lifetimePendingCount() {
        return counters.lifetimePendingCount();
    }

    public long lifetimePendingBytes() {
        return counters.lifetimePendingBytes();
    }

    public long queuePendingCount() {
        return counters.queuePendingCount();
    }

    public long queuePendingBytes() {
        return counters.queuePendingBytes();
    }

    public boolean metadataCaughtUp() {
        return metadataCaughtUp.get();
    }

    public boolean allContentMaterialized() {
        return allContentMaterialized.get();
    }

    public boolean isPending(String contentDigest) {
        return pendingIndex.isPending(contentDigest);
    }

    public int pendingItemCount() {
        return pendingIndex.size();
    }
}
