package com.lbg.markets.surveillance.docsync.log;

import com.lbg.markets.surveillance.docsync.store.ContentStore;
import com.lbg.markets.surveillance.docsync.util.ContentDigest;
import com.lbg.markets.surveillance.docsync.util.DocTicket;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process node. Documents live in memory; content goes to the supplied store.
 * Joining by ticket attaches to a local document with the ticket's namespace.
 */
public class InMemoryDocumentNode implements DocumentNode {

    private static final Logger LOG = Logger.getLogger(InMemoryDocumentNode.class);

    private final String nodeId;
    private final ContentStore contentStore;
    private final Map<String, InMemoryDocumentLog> documents = new ConcurrentHashMap<>();
    private final Set<String> authors = ConcurrentHashMap.newKeySet();

    public InMemoryDocumentNode(String nodeId, ContentStore contentStore) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId cannot be blank");
        }
        this.nodeId = nodeId;
        this.contentStore = contentStore;
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    @Override
    public InMemoryDocumentLog create(String datasetName) {
        String namespaceId = ContentDigest.shortForm(ContentDigest.of(UUID.randomUUID().toString()));
        InMemoryDocumentLog doc = new InMemoryDocumentLog(namespaceId, datasetName, nodeId, contentStore);
        documents.put(namespaceId, doc);
        LOG.infof("Created new doc %s for %s", namespaceId, datasetName);
        return doc;
    }

    @Override
    public InMemoryDocumentLog importTicket(String datasetName, String ticket) {
        DocTicket parsed = DocTicket.parse(ticket);
        InMemoryDocumentLog doc = documents.computeIfAbsent(parsed.namespaceId(),
                ns -> new InMemoryDocumentLog(ns, datasetName, nodeId, contentStore));
        LOG.infof("Imported doc %s for %s from node %s", parsed.namespaceId(), datasetName, parsed.nodeId());
        return doc;
    }

    @Override
    public String ensureAuthor(byte[] authorSecret) {
        String authorId = ContentDigest.of(authorSecret);
        if (authors.add(authorId)) {
            LOG.debugf("Imported author %s", ContentDigest.shortForm(authorId));
        }
        return authorId;
    }

    @Override
    public ContentStore contentStore() {
        return contentStore;
    }

    public Set<String> authors() {
        return Set.copyOf(authors);
    }
}
