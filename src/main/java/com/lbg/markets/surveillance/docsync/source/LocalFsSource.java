package com.lbg.markets.surveillance.docsync.source;

import com.lbg.markets.surveillance.docsync.domain.FileDescriptor;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

/**
 * Source provider for a local directory.
 * Lists the regular files directly inside it, skipping hidden ones (like .DS_Store).
 */
@ApplicationScoped
public class LocalFsSource implements SourceProvider {

    @Override
    public Stream<FileDescriptor> list(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Source directory does not exist: " + directory);
        }

        return Files.list(directory)
                .filter(Files::isRegularFile)
                .filter(p -> !p.getFileName().toString().startsWith("."))
                .sorted()
                .map(this::toDescriptor);
    }

    @Override
    public byte[] read(FileDescriptor file) throws IOException {
        return Files.readAllBytes(Paths.get(file.sourcePath()));
    }

    private FileDescriptor toDescriptor(Path file) {
        try {
            return new FileDescriptor(
                    file.toString(),
                    file.getFileName().toString(),
                    Files.size(file)
            );
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read file attributes: " + file, e);
        }
    }
}
