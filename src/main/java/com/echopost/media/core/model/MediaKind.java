package com.echopost.media.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of media tracked by the device media index.
 */
public enum MediaKind {
    PHOTO,
    VIDEO;

    /**
     * Parses the parser's {@code media_type} value ({@code "photo"} or {@code "video"}).
     */
    public static Optional<MediaKind> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "photo", "image" -> Optional.of(PHOTO);
            case "video" -> Optional.of(VIDEO);
            default -> throw new IllegalArgumentException("Unknown media type: " + label);
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
