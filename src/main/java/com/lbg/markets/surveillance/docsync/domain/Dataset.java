package com.lbg.markets.surveillance.docsync.domain;

/**
 * The fixed set of replicated datasets.
 * Declaration order is the order of tickets in a shared ticket string.
 */
public enum Dataset {
    RESOURCE("resource", Kind.RESOURCE),
    FOLDER("folder", Kind.FOLDER),
    NODE("node", Kind.NODE),
    RESOURCE1("resource1", Kind.RESOURCE),
    RESOURCE2("resource2", Kind.RESOURCE),
    RESOURCE3("resource3", Kind.RESOURCE);

    public enum Kind {
        FOLDER,
        NODE,
        RESOURCE
    }

    private final String tableName;
    private final Kind kind;

    Dataset(String tableName, Kind kind) {
        this.tableName = tableName;
        this.kind = kind;
    }

    public String tableName() {
        return tableName;
    }

    public Kind kind() {
        return kind;
    }
}
