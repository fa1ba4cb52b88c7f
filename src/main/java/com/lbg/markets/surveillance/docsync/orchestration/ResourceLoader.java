package com.lbg.markets.surveillance.docsync.orchestration;

import com.lbg.markets.surveillance.docsync.domain.FileDescriptor;
import com.lbg.markets.surveillance.docsync.entity.Resources;
import com.lbg.markets.surveillance.docsync.source.SourceProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads every file of a local directory into a resource dataset.
 * Handles the flow: list -> read -> add as resource.
 */
@ApplicationScoped
public class ResourceLoader {

    private static final Logger LOG = Logger.getLogger(ResourceLoader.class);

    @Inject
    SourceProvider sourceProvider;

    /**
     * @return the number of files added
     */
    public int load(Resources resources, Path directory) throws IOException {
        LOG.infof("Loading files from %s into %s", directory, resources.datasetName());

        List<FileDescriptor> files;
        try (Stream<FileDescriptor> listing = sourceProvider.list(directory)) {
            files = listing.collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        for (FileDescriptor file : files) {
            byte[] content = sourceProvider.read(file);
            try {
                resources.addFile(file.fileName(), content);
            } catch (IOException e) {
                throw new IOException("Failed to add file to resources: " + file.sourcePath(), e);
            }
            LOG.debugf("Added file %s (%d bytes)", file.fileName(), content.length);
        }

        LOG.infof("Loaded %d files into %s", files.size(), resources.datasetName());
        return files.size();
    }
}
