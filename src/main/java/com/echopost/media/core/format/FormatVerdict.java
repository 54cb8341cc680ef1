package com.echopost.media.core.format;

import com.echopost.media.core.model.MediaKind;

import java.util.Optional;

/**
 * Result of classifying a file path by extension.
 *
 * @param kind {@code null} when the format is not supported
 */
public record FormatVerdict(String mimeType, boolean supported, MediaKind kind) {

    static FormatVerdict unsupported() {
        return new FormatVerdict(FormatClassifier.UNKNOWN_MIME_TYPE, false, null);
    }

    public Optional<MediaKind> optionalKind() {
        return Optional.ofNullable(kind);
    }
}
