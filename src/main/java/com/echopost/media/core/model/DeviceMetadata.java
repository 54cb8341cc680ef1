package com.echopost.media.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Device-reported attributes attached to a candidate.
 *
 * @param durationSeconds {@code null} for photos
 */
public record DeviceMetadata(Instant creationTime,
                             Double latitude,
                             Double longitude,
                             int width,
                             int height,
                             long fileSizeBytes,
                             Double durationSeconds,
                             int orientation) {
    public DeviceMetadata {
        Objects.requireNonNull(creationTime, "creationTime");
    }

    static DeviceMetadata from(RawAssetHandle handle, long fileSizeBytes) {
        Double latitude = handle.optionalLocation().map(GeoPoint::latitude).orElse(null);
        Double longitude = handle.optionalLocation().map(GeoPoint::longitude).orElse(null);
        Double duration = handle.isVideo() ? handle.duration().toMillis() / 1000.0 : null;
        return new DeviceMetadata(handle.creationTime(), latitude, longitude,
            handle.width(), handle.height(), fileSizeBytes, duration, handle.orientation());
    }
}
