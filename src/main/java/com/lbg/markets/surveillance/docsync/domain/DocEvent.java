package com.lbg.markets.surveillance.docsync.domain;

/**
 * Replication event emitted by a dataset's document log, in per-dataset order.
 * The variants are closed; consumers dispatch through {@link Visitor}.
 */
public interface DocEvent {

    void accept(Visitor visitor) throws InterruptedException;

    interface Visitor {
        void onRemoteInsert(RemoteInsert event) throws InterruptedException;

        void onLocalInsert(LocalInsert event);

        void onContentReady(ContentReady event) throws InterruptedException;

        void onAllClear(AllClear event);

        void onPeerJoined(PeerJoined event);

        void onPeerLeft(PeerLeft event);

        void onRoundComplete(RoundComplete event);
    }

    /**
     * A peer wrote an entry; only the metadata has arrived so far.
     */
    record RemoteInsert(
            String contentDigest,
            long contentSize,
            String logicalKey,
            String datasetName,
            String peerId
    ) implements DocEvent {
        public RemoteInsert {
            if (contentDigest == null || contentDigest.isBlank()) {
                throw new IllegalArgumentException("contentDigest cannot be blank");
            }
            if (contentSize < 0) {
                throw new IllegalArgumentException("contentSize cannot be negative");
            }
        }

        @Override
        public void accept(Visitor visitor) throws InterruptedException {
            visitor.onRemoteInsert(this);
        }
    }

    record LocalInsert(LogEntry entry) implements DocEvent {
        @Override
        public void accept(Visitor visitor) {
            visitor.onLocalInsert(this);
        }
    }

    /**
     * The bytes behind a digest are now available in the local store.
     */
    record ContentReady(String contentDigest) implements DocEvent {
        @Override
        public void accept(Visitor visitor) throws InterruptedException {
            visitor.onContentReady(this);
        }
    }

    /**
     * Every piece of content referenced during the initial catch-up has been fetched.
     */
    record AllClear() implements DocEvent {
        @Override
        public void accept(Visitor visitor) {
            visitor.onAllClear(this);
        }
    }

    record PeerJoined(String peerId) implements DocEvent {
        @Override
        public void accept(Visitor visitor) {
            visitor.onPeerJoined(this);
        }
    }

    record PeerLeft(String peerId) implements DocEvent {
        @Override
        public void accept(Visitor visitor) {
            visitor.onPeerLeft(this);
        }
    }

    /**
     * The log finished a reconciliation round with a peer (metadata only, not content).
     */
    record RoundComplete(String info) implements DocEvent {
        @Override
        public void accept(Visitor visitor) {
            visitor.onRoundComplete(this);
        }
    }
}
