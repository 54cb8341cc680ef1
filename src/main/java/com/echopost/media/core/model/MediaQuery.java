package com.echopost.media.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured search request produced by the natural-language parser.
 */
public record MediaQuery(List<String> terms,
                         String originalQuery,
                         DateRange dateRange,
                         MediaKind mediaKind,
                         String directoryScope) {
    public MediaQuery {
        terms = terms == null ? List.of() : List.copyOf(terms);
        originalQuery = Objects.requireNonNullElse(originalQuery, "");
        if (directoryScope != null && directoryScope.isBlank()) {
            directoryScope = null;
        }
    }

    public static MediaQuery everything() {
        return new MediaQuery(List.of(), "", null, null, null);
    }

    public static MediaQuery ofKind(MediaKind kind) {
        return new MediaQuery(List.of(), "", null, kind, null);
    }

    public Optional<DateRange> optionalDateRange() {
        return Optional.ofNullable(dateRange);
    }

    public Optional<MediaKind> optionalMediaKind() {
        return Optional.ofNullable(mediaKind);
    }

    public Optional<String> optionalDirectoryScope() {
        return Optional.ofNullable(directoryScope);
    }

    public MediaQuery withDirectoryScope(String directory) {
        return new MediaQuery(terms, originalQuery, dateRange, mediaKind, directory);
    }
}
