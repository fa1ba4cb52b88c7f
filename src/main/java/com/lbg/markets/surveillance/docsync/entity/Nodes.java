package com.lbg.markets.surveillance.docsync.entity;

import com.lbg.markets.surveillance.docsync.log.DocumentLog;
import com.lbg.markets.surveillance.docsync.store.ContentStore;

public class Nodes extends EntityTable<Node> {

    public Nodes(DocumentLog doc, ContentStore contentStore, Node.Codec codec,
                 String authorId, String ticket, long maxEntityBytes) {
        super(doc, contentStore, codec, authorId, ticket, maxEntityBytes);
    }
}
