package com.lbg.markets.surveillance.docsync.log;

import com.lbg.markets.surveillance.docsync.domain.DocEvent;
import com.lbg.markets.surveillance.docsync.domain.LogEntry;
import com.lbg.markets.surveillance.docsync.store.InMemoryContentStore;
import com.lbg.markets.surveillance.docsync.util.ContentDigest;
import com.lbg.markets.surveillance.docsync.util.DocTicket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentLogTest {

    private InMemoryContentStore store;
    private InMemoryDocumentLog doc;

    @BeforeEach
    void setup() {
        store = new InMemoryContentStore();
        doc = new InMemoryDocumentLog("ns-1", "folder", "node-a", store);
    }

    @Test
    void shouldDeliverEventsInPublishOrder() throws Exception {
        EventSubscription events = doc.subscribe();
        byte[] content = "blob".getBytes(StandardCharsets.UTF_8);

        doc.receiveRemote("peer-b", "k1".getBytes(StandardCharsets.UTF_8), ContentDigest.of(content), content.length);
        doc.contentArrived(content);
        doc.publish(new DocEvent.AllClear());

        DocEvent.RemoteInsert insert = assertInstanceOf(DocEvent.RemoteInsert.class, events.next());
        assertEquals("k1", insert.logicalKey());
        assertEquals("folder", insert.datasetName());
        assertEquals("peer-b", insert.peerId());
        assertEquals(content.length, insert.contentSize());

        DocEvent.ContentReady ready = assertInstanceOf(DocEvent.ContentReady.class, events.next());
        assertEquals(ContentDigest.of(content), ready.contentDigest());
        assertInstanceOf(DocEvent.AllClear.class, events.next());
        assertTrue(store.contains(ready.contentDigest()));
    }

    @Test
    void shouldRecordButNotAnnounceUndecodableKey() throws Exception {
        EventSubscription events = doc.subscribe();
        byte[] content = "blob".getBytes(StandardCharsets.UTF_8);

        doc.receiveRemote("peer-b", new byte[]{(byte) 0xC3, (byte) 0x28}, ContentDigest.of(content), content.length);
        doc.publish(new DocEvent.PeerJoined("peer-b"));

        assertInstanceOf(DocEvent.PeerJoined.class, events.next());
        assertEquals(1, doc.latestPerKey().size());
    }

    @Test
    void shouldKeepLatestRevisionPerKey() throws IOException {
        byte[] key = "k".getBytes(StandardCharsets.UTF_8);
        doc.append("author-1", key, "v1".getBytes(StandardCharsets.UTF_8));
        LogEntry latest = doc.append("author-1", key, "v2".getBytes(StandardCharsets.UTF_8));
        doc.append("author-1", "a".getBytes(StandardCharsets.UTF_8), "other".getBytes(StandardCharsets.UTF_8));

        List<LogEntry> entries = doc.latestPerKey();

        assertEquals(2, entries.size());
        assertArrayEquals("a".getBytes(StandardCharsets.UTF_8), entries.get(0).key());
        assertEquals(latest.contentDigest(), entries.get(1).contentDigest());
        assertArrayEquals("v2".getBytes(StandardCharsets.UTF_8), store.resolve(latest.contentDigest()));
    }

    @Test
    void shouldPublishLocalInsertOnAppend() throws Exception {
        EventSubscription events = doc.subscribe();

        LogEntry entry = doc.append("author-1", "k".getBytes(StandardCharsets.UTF_8), new byte[]{1, 2});

        DocEvent.LocalInsert insert = assertInstanceOf(DocEvent.LocalInsert.class, events.next());
        assertEquals(entry.contentDigest(), insert.entry().contentDigest());
        assertEquals("author-1", insert.entry().authorId());
    }

    @Test
    void shouldEndSubscriptionsOnClose() throws Exception {
        EventSubscription events = doc.subscribe();

        doc.close();

        assertNull(events.next());
        assertNull(events.next());
        assertEquals(0, doc.subscriberCount());
        assertThrows(SubscriptionException.class, () -> doc.subscribe());
    }

    @Test
    void shouldStopDeliveringAfterSubscriptionClosed() throws Exception {
        EventSubscription first = doc.subscribe();
        EventSubscription second = doc.subscribe();
        assertEquals(2, doc.subscriberCount());

        first.close();
        doc.publish(new DocEvent.PeerJoined("peer-b"));

        assertEquals(1, doc.subscriberCount());
        assertNull(first.next());
        assertInstanceOf(DocEvent.PeerJoined.class, second.next());
    }

    @Test
    void shouldShareParsableTicket() {
        DocTicket ticket = DocTicket.parse(doc.share());

        assertEquals("ns-1", ticket.namespaceId());
        assertEquals("node-a", ticket.nodeId());
    }
}
