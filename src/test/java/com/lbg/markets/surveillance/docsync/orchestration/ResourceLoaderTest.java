package com.lbg.markets.surveillance.docsync.orchestration;

import com.lbg.markets.surveillance.docsync.entity.Resource;
import com.lbg.markets.surveillance.docsync.entity.Resources;
import com.lbg.markets.surveillance.docsync.log.InMemoryDocumentLog;
import com.lbg.markets.surveillance.docsync.store.InMemoryContentStore;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class ResourceLoaderTest {

    @Inject
    ResourceLoader loader;

    private Path imagesDir;
    private Resources resources;

    @BeforeEach
    void setup() throws IOException {
        imagesDir = Files.createTempDirectory("test-images-");
        InMemoryContentStore store = new InMemoryContentStore();
        resources = new Resources(new InMemoryDocumentLog("ns-res", "resource", "node-a", store), store,
                new Resource.Codec("File not found"), "author-1", null, 1024);
    }

    @AfterEach
    void cleanup() throws IOException {
        if (imagesDir != null && Files.exists(imagesDir)) {
            deleteRecursively(imagesDir);
        }
    }

    @Test
    void shouldAddEveryFileAsResource() throws IOException {
        Files.write(imagesDir.resolve("cat.png"), new byte[]{1, 2, 3});
        Files.write(imagesDir.resolve("dog.png"), new byte[]{4, 5});
        Files.writeString(imagesDir.resolve(".hidden"), "skip");

        int added = loader.load(resources, imagesDir);

        assertEquals(2, added);
        List<Resource> found = resources.search();
        assertEquals(List.of("cat.png", "dog.png"),
                found.stream().map(Resource::name).sorted().collect(Collectors.toList()));
        Resource cat = found.stream().filter(r -> r.name().equals("cat.png")).findFirst().orElseThrow();
        assertArrayEquals(new byte[]{1, 2, 3}, cat.blob());
    }

    @Test
    void shouldStopAtOversizedFile() throws IOException {
        Files.write(imagesDir.resolve("huge.bin"), new byte[2048]);

        assertThrows(IllegalArgumentException.class, () -> loader.load(resources, imagesDir));
        assertTrue(resources.search().isEmpty());
    }

    @Test
    void shouldFailForMissingDirectory() {
        assertThrows(IOException.class, () -> loader.load(resources, imagesDir.resolve("absent")));
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
