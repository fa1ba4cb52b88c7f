package com.lbg.markets.surveillance.docsync.store;

import com.lbg.markets.surveillance.docsync.util.ContentDigest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FsContentStoreTest {

    private Path baseDir;
    private FsContentStore store;

    @BeforeEach
    void setup() throws IOException {
        baseDir = Files.createTempDirectory("test-blobs-");
        store = new FsContentStore(baseDir.resolve("blobs"));
    }

    @AfterEach
    void cleanup() throws IOException {
        if (baseDir != null && Files.exists(baseDir)) {
            deleteRecursively(baseDir);
        }
    }

    @Test
    void shouldStoreContentUnderItsDigest() throws IOException {
        byte[] content = "Hello, world!".getBytes(StandardCharsets.UTF_8);

        String digest = store.put(content);

        assertEquals(ContentDigest.of(content), digest);
        assertTrue(store.contains(digest));
        assertArrayEquals(content, store.resolve(digest));
        assertTrue(Files.exists(baseDir.resolve("blobs").resolve(digest.substring(0, 2)).resolve(digest)));
    }

    @Test
    void shouldStoreIdenticalContentOnce() throws IOException {
        byte[] content = "same".getBytes(StandardCharsets.UTF_8);

        String first = store.put(content);
        String second = store.put(content.clone());

        assertEquals(first, second);
        try (var files = Files.list(baseDir.resolve("blobs").resolve(first.substring(0, 2)))) {
            assertEquals(1, files.count(), "No temp files left behind");
        }
    }

    @Test
    void shouldAcceptConcurrentPutsOfSameContent() throws Exception {
        int writers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            for (int round = 0; round < 50; round++) {
                byte[] content = new byte[64 * 1024];
                Arrays.fill(content, (byte) round);
                CyclicBarrier barrier = new CyclicBarrier(writers);
                List<Future<String>> puts = new ArrayList<>();
                for (int i = 0; i < writers; i++) {
                    puts.add(executor.submit(() -> {
                        barrier.await();
                        return store.put(content);
                    }));
                }
                for (Future<String> put : puts) {
                    assertEquals(ContentDigest.of(content), put.get(10, TimeUnit.SECONDS));
                }
                assertArrayEquals(content, store.resolve(ContentDigest.of(content)));
            }
        } finally {
            executor.shutdownNow();
        }

        try (var files = Files.walk(baseDir.resolve("blobs"))) {
            assertTrue(files.noneMatch(p -> p.toString().endsWith(".tmp")), "No temp files left behind");
        }
    }

    @Test
    void shouldReportMissingContent() {
        String digest = ContentDigest.of("never stored");

        assertFalse(store.contains(digest));
        ContentNotFoundException e = assertThrows(ContentNotFoundException.class, () -> store.resolve(digest));
        assertEquals(digest, e.contentDigest());
    }

    @Test
    void shouldTreatMalformedDigestAsMissing() {
        assertFalse(store.contains("../escape"));
        assertThrows(ContentNotFoundException.class, () -> store.resolve("../escape"));
    }

    private void deleteRecursively(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            try (var stream = Files.list(path)) {
                stream.forEach(p -> {
                    try {
                        deleteRecursively(p);
                    } catch (IOException e) {
                        throw new RuntimeException(e);
                    }
                });
            }
        }
        Files.deleteIfExists(path);
    }
}
