package com.lbg.markets.surveillance.docsync.entity;

public record Folder(String folderId, String folderName) {

    public static final class Codec extends CborEntityCodec<Folder> {

        private final String untitledLabel;

        public Codec(String untitledLabel) {
            super(Folder.class);
            this.untitledLabel = untitledLabel;
        }

        @Override
        public Folder missingPlaceholder(String key) {
            return new Folder(key, untitledLabel);
        }
    }
}
