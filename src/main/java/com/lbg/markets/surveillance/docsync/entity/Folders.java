package com.lbg.markets.surveillance.docsync.entity;

import com.lbg.markets.surveillance.docsync.log.DocumentLog;
import com.lbg.markets.surveillance.docsync.store.ContentStore;

import java.io.IOException;
import java.util.UUID;

public class Folders extends EntityTable<Folder> {

    public Folders(DocumentLog doc, ContentStore contentStore, Folder.Codec codec,
                   String authorId, String ticket, long maxEntityBytes) {
        super(doc, contentStore, codec, authorId, ticket, maxEntityBytes);
    }

    public Folder insertFolder(String folderName) throws IOException {
        Folder folder = new Folder(UUID.randomUUID().toString(), folderName);
        insertEntity(folder.folderId(), folder);
        return folder;
    }
}
