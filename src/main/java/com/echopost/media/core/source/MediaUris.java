package com.echopost.media.core.source;

import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Conversions between stored media references and file system paths.
 * References are {@code file:} URIs; bare paths are accepted for older records.
 */
public final class MediaUris {

    private static final String LOCAL_HOST = "localhost";

    private MediaUris() {
    }

    public static String toUri(Path path) {
        return path.toAbsolutePath().normalize().toUri().toString();
    }

    public static Optional<Path> toPath(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String trimmed = reference.trim();
        try {
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("file:")) {
                URI uri = URI.create(trimmed);
                String authority = uri.getAuthority();
                if (authority == null) {
                    return Optional.of(Path.of(uri));
                }
                if (authority.isEmpty() || authority.equalsIgnoreCase(LOCAL_HOST)) {
                    return Optional.of(Path.of(uri.getPath()));
                }
                // file://relative/name: keep authority and path together
                return Optional.of(Path.of(authority + uri.getPath()));
            }
            if (trimmed.contains("://")) {
                return Optional.empty();
            }
            return Optional.of(Path.of(trimmed));
        } catch (IllegalArgumentException e) {
            // also covers InvalidPathException
            return Optional.empty();
        }
    }

    public static String fileName(String reference) {
        return toPath(reference)
            .map(Path::getFileName)
            .map(Path::toString)
            .orElse("");
    }
}
