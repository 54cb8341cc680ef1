package com.echopost.media.core.source;

import com.echopost.media.core.model.GeoPoint;

import java.time.Duration;

/**
 * Capture details read from inside a media file.
 *
 * @param location    GPS position, or {@code null} when none was recorded
 * @param duration    playback length of a video, zero for stills or when unknown
 * @param orientation EXIF orientation (1 to 8), or 0 when absent
 */
record EmbeddedMetadata(GeoPoint location, Duration duration, int orientation) {

    static final EmbeddedMetadata NONE = new EmbeddedMetadata(null, Duration.ZERO, 0);
}
