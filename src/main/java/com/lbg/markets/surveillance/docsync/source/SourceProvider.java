package com.lbg.markets.surveillance.docsync.source;

import com.lbg.markets.surveillance.docsync.domain.FileDescriptor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.Stream;

public interface SourceProvider {
    Stream<FileDescriptor> list(Path directory) throws IOException;

    byte[] read(FileDescriptor file) throws IOException;
}
