package com.lbg.markets.surveillance.docsync.entity;

/**
 * Tree node entry of the node dataset.
 */
public record Node(String nodeName, long key, String nodeId) {

    public static final class Codec extends CborEntityCodec<Node> {

        private final String missingLabel;

        public Codec(String missingLabel) {
            super(Node.class);
            this.missingLabel = missingLabel;
        }

        @Override
        public Node missingPlaceholder(String key) {
            return new Node(missingLabel, 0, key);
        }
    }
}
