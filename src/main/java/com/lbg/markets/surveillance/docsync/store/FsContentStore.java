package com.lbg.markets.surveillance.docsync.store;

import com.lbg.markets.surveillance.docsync.util.ContentDigest;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Local filesystem store. Each blob is one file named by its digest,
 * fanned out by the first two hex characters.
 */
public class FsContentStore implements ContentStore {

    private static final Logger LOG = Logger.getLogger(FsContentStore.class);

    private final Path basePath;

    public FsContentStore(Path basePath) throws IOException {
        this.basePath = basePath;
        Files.createDirectories(basePath);
    }

    @Override
    public String put(byte[] content) throws IOException {
        String digest = ContentDigest.of(content);
        Path target = pathFor(digest);
        if (Files.exists(target)) {
            return digest;
        }
        Files.createDirectories(target.getParent());

        // Unique temp file then atomic rename so readers never see a partial blob
        Path temp = Files.createTempFile(target.getParent(), digest, ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                out.write(content);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            if (Files.exists(target)) {
                // a concurrent put of the same content won
                return digest;
            }
            throw e;
        }

        LOG.debugf("Stored blob %s (%d bytes)", ContentDigest.shortForm(digest), content.length);
        return digest;
    }

    @Override
    public byte[] resolve(String contentDigest) throws IOException {
        if (!ContentDigest.isValid(contentDigest)) {
            throw new ContentNotFoundException(contentDigest);
        }
        try {
            return Files.readAllBytes(pathFor(contentDigest));
        } catch (NoSuchFileException e) {
            throw new ContentNotFoundException(contentDigest);
        }
    }

    @Override
    public boolean contains(String contentDigest) {
        return ContentDigest.isValid(contentDigest) && Files.exists(pathFor(contentDigest));
    }

    private Path pathFor(String digest) {
        return basePath.resolve(digest.substring(0, 2)).resolve(digest);
    }
}
