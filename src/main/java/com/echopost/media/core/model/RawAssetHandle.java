package com.echopost.media.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of an asset owned by the media index. The engine only reads it.
 *
 * @param relativePath directory the index reports for the asset, used for placeholder paths
 */
public record RawAssetHandle(String id,
                             MediaKind kind,
                             Instant creationTime,
                             GeoPoint location,
                             int width,
                             int height,
                             Duration duration,
                             int orientation,
                             String title,
                             String relativePath) {
    public RawAssetHandle {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(creationTime, "creationTime");
        duration = Objects.requireNonNullElse(duration, Duration.ZERO);
        title = Objects.requireNonNullElse(title, "");
    }

    public Optional<GeoPoint> optionalLocation() {
        return Optional.ofNullable(location);
    }

    public boolean isVideo() {
        return kind == MediaKind.VIDEO;
    }
}
