package com.lbg.markets.surveillance.docsync.log;

import com.lbg.markets.surveillance.docsync.store.ContentStore;

import java.io.IOException;

/**
 * Local replica host: owns the documents and the content store they reference.
 */
public interface DocumentNode {

    String nodeId();

    DocumentLog create(String datasetName) throws IOException;

    /**
     * Join the document named by a ticket issued elsewhere.
     */
    DocumentLog importTicket(String datasetName, String ticket) throws IOException;

    /**
     * Register the author derived from the secret unless it is already known.
     *
     * @return the author id
     */
    String ensureAuthor(byte[] authorSecret) throws IOException;

    ContentStore contentStore();
}
