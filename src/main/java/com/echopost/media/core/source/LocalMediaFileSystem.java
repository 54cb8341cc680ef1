package com.echopost.media.core.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * {@link MediaFileSystem} over the default NIO file system.
 */
public final class LocalMediaFileSystem implements MediaFileSystem {

    @Override
    public boolean exists(Path path) throws IOException {
        if (path == null) {
            return false;
        }
        try {
            return Files.readAttributes(path, BasicFileAttributes.class).isRegularFile();
        } catch (FileSystemException e) {
            if (e instanceof AccessDeniedException) {
                throw e;
            }
            return false;
        }
    }

    @Override
    public boolean isReadable(Path path) {
        return path != null && Files.isReadable(path);
    }

    @Override
    public long size(Path path) throws IOException {
        return Files.size(path);
    }

    @Override
    public InputStream open(Path path) throws IOException {
        return Files.newInputStream(path);
    }
}
