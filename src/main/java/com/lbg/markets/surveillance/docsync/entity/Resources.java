package com.lbg.markets.surveillance.docsync.entity;

import com.lbg.markets.surveillance.docsync.log.DocumentLog;
import com.lbg.markets.surveillance.docsync.store.ContentStore;

import java.io.IOException;
import java.util.UUID;

public class Resources extends EntityTable<Resource> {

    public Resources(DocumentLog doc, ContentStore contentStore, Resource.Codec codec,
                     String authorId, String ticket, long maxEntityBytes) {
        super(doc, contentStore, codec, authorId, ticket, maxEntityBytes);
    }

    public Resource addFile(String name, byte[] blob) throws IOException {
        Resource resource = new Resource(UUID.randomUUID().toString(), name, blob);
        insertEntity(resource.id(), resource);
        return resource;
    }
}
