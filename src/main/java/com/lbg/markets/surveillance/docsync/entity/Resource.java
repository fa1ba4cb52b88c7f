package com.lbg.markets.surveillance.docsync.entity;

/**
 * Named binary file, typically an image.
 */
public record Resource(String id, String name, byte[] blob) {

    public Resource {
        blob = blob != null ? blob.clone() : new byte[0];
    }

    @Override
    public byte[] blob() {
        return blob.clone();
    }

    public static final class Codec extends CborEntityCodec<Resource> {

        private final String missingLabel;

        public Codec(String missingLabel) {
            super(Resource.class);
            this.missingLabel = missingLabel;
        }

        @Override
        public Resource missingPlaceholder(String key) {
            return new Resource(key, missingLabel, new byte[0]);
        }
    }
}
