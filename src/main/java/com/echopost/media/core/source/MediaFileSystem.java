package com.echopost.media.core.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Read-only file access used to probe media files.
 */
public interface MediaFileSystem {

    /**
     * @return whether a regular file is present at {@code path}
     * @throws java.nio.file.AccessDeniedException when the file or a parent directory cannot be inspected
     */
    boolean exists(Path path) throws IOException;

    boolean isReadable(Path path);

    long size(Path path) throws IOException;

    InputStream open(Path path) throws IOException;

    /**
     * Reads up to {@code length} leading bytes; shorter files yield a shorter array.
     */
    default byte[] readHeader(Path path, int length) throws IOException {
        try (InputStream in = open(path)) {
            return in.readNBytes(length);
        }
    }
}
