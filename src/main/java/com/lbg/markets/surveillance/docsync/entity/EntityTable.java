package com.lbg.markets.surveillance.docsync.entity;

import com.lbg.markets.surveillance.docsync.domain.LogEntry;
import com.lbg.markets.surveillance.docsync.log.DocumentLog;
import com.lbg.markets.surveillance.docsync.store.ContentNotFoundException;
import com.lbg.markets.surveillance.docsync.store.ContentStore;
import com.lbg.markets.surveillance.docsync.util.Keys;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Read/write surface over one dataset document for one entity type.
 * Independent of sync progress: it reads whatever the log and store hold right now.
 */
public class EntityTable<T> {

    private static final Logger LOG = Logger.getLogger(EntityTable.class);

    protected final DocumentLog doc;
    protected final ContentStore contentStore;
    protected final EntityCodec<T> codec;
    private final String authorId;
    private final String ticket;
    private final long maxEntityBytes;

    /**
     * @param ticket the ticket issued for this document, or null when this side joined one
     */
    public EntityTable(
            DocumentLog doc,
            ContentStore contentStore,
            EntityCodec<T> codec,
            String authorId,
            String ticket,
            long maxEntityBytes
    ) {
        this.doc = doc;
        this.contentStore = contentStore;
        this.codec = codec;
        this.authorId = authorId;
        this.ticket = ticket;
        this.maxEntityBytes = maxEntityBytes;
    }

    /**
     * Latest revision of every key. Entries whose content is not available locally,
     * or cannot be read from the store, come back as the codec's placeholder.
     *
     * @throws KeyDecodeException if any key is not valid UTF-8
     */
    public List<T> search() throws IOException {
        List<T> entities = new ArrayList<>();
        for (LogEntry entry : doc.latestPerKey()) {
            entities.add(fromEntry(entry));
        }
        return entities;
    }

    /**
     * Write a new revision of a key. Nothing is written if the content is over the size limit.
     */
    public void insert(String key, byte[] content) throws IOException {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be empty");
        }
        if (content.length > maxEntityBytes) {
            throw new SizeLimitExceededException(content.length, maxEntityBytes);
        }
        doc.append(authorId, key.getBytes(StandardCharsets.UTF_8), content);
        LOG.debugf("Inserted %s into %s (%d bytes)", key, doc.datasetName(), content.length);
    }

    public void insertEntity(String key, T entity) throws IOException {
        insert(key, codec.toBytes(entity));
    }

    public String ticketString() {
        return ticket != null ? ticket : "";
    }

    public String namespaceId() {
        return doc.namespaceId();
    }

    public String datasetName() {
        return doc.datasetName();
    }

    private T fromEntry(LogEntry entry) throws IOException {
        String key = decodeKey(entry.key());
        byte[] content;
        try {
            content = contentStore.resolve(entry.contentDigest());
        } catch (ContentNotFoundException e) {
            LOG.debugf("Content for %s in %s not available, using placeholder", key, doc.datasetName());
            return codec.missingPlaceholder(key);
        } catch (IOException e) {
            LOG.warnf(e, "Failed to read content for %s in %s, using placeholder", key, doc.datasetName());
            return codec.missingPlaceholder(key);
        }
        return codec.fromBytes(content);
    }

    private static String decodeKey(byte[] key) throws KeyDecodeException {
        try {
            return Keys.decode(key);
        } catch (CharacterCodingException e) {
            throw new KeyDecodeException("Invalid key", e);
        }
    }
}
