package com.echopost.media.core.source;

import com.echopost.media.core.model.DateRange;
import com.echopost.media.core.model.MediaKind;
import com.echopost.media.core.model.RawAssetHandle;

import java.time.Duration;
import java.util.Objects;

/**
 * Constraints pushed down to the media index. Dimensions are never constrained;
 * only video duration is capped.
 */
public record AssetFilter(DateRange dateRange, MediaKind kind, Duration maxVideoDuration) {
    public AssetFilter {
        Objects.requireNonNull(maxVideoDuration, "maxVideoDuration");
    }

    public static AssetFilter unrestricted(Duration maxVideoDuration) {
        return new AssetFilter(null, null, maxVideoDuration);
    }

    public boolean matches(RawAssetHandle handle) {
        if (kind != null && handle.kind() != kind) {
            return false;
        }
        if (dateRange != null && !dateRange.contains(handle.creationTime())) {
            return false;
        }
        return !handle.isVideo() || handle.duration().compareTo(maxVideoDuration) <= 0;
    }
}
