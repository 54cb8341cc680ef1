package com.echopost.media.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for scanning, batched resolution and validation.
 *
 * @param batchSize           items resolved concurrently; batches run one after another
 * @param itemTimeout         upper bound for resolving or validating a single item
 * @param albumPageSize       assets read from each album per scan
 * @param maxVideoDuration    longer videos are excluded from scans
 * @param placeholderFallback emit a synthesized path when the index cannot provide a file
 * @param verifyImageHeaders  check image magic bytes during validation
 * @param recoveryEnabled     attempt to relocate stale references during validation
 */
public record EngineSettings(int batchSize,
                             Duration itemTimeout,
                             int albumPageSize,
                             Duration maxVideoDuration,
                             boolean placeholderFallback,
                             boolean verifyImageHeaders,
                             boolean recoveryEnabled) {

    public static final String RESOURCE_NAME = "media-engine.properties";

    static final int DEFAULT_BATCH_SIZE = 5;
    static final long DEFAULT_ITEM_TIMEOUT_MILLIS = 3_000;
    static final int DEFAULT_ALBUM_PAGE_SIZE = 100;
    static final long DEFAULT_MAX_VIDEO_SECONDS = 15 * 60;

    public EngineSettings {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (albumPageSize < 1) {
            throw new IllegalArgumentException("albumPageSize must be positive: " + albumPageSize);
        }
        Objects.requireNonNull(itemTimeout, "itemTimeout");
        Objects.requireNonNull(maxVideoDuration, "maxVideoDuration");
        if (itemTimeout.isNegative() || itemTimeout.isZero()) {
            throw new IllegalArgumentException("itemTimeout must be positive: " + itemTimeout);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
            DEFAULT_BATCH_SIZE,
            Duration.ofMillis(DEFAULT_ITEM_TIMEOUT_MILLIS),
            DEFAULT_ALBUM_PAGE_SIZE,
            Duration.ofSeconds(DEFAULT_MAX_VIDEO_SECONDS),
            true,
            true,
            true
        );
    }

    public static EngineSettings load() {
        return load(SettingSources.fromClasspath(RESOURCE_NAME));
    }

    static EngineSettings load(SettingSources sources) {
        return new EngineSettings(
            sources.intValue("media.batchSize", "batchSize", DEFAULT_BATCH_SIZE),
            Duration.ofMillis(sources.longValue("media.itemTimeoutMillis", "itemTimeoutMillis", DEFAULT_ITEM_TIMEOUT_MILLIS)),
            sources.intValue("media.albumPageSize", "albumPageSize", DEFAULT_ALBUM_PAGE_SIZE),
            Duration.ofSeconds(sources.longValue("media.maxVideoDurationSeconds", "maxVideoDurationSeconds", DEFAULT_MAX_VIDEO_SECONDS)),
            sources.booleanValue("media.placeholderFallback", "placeholderFallback", true),
            sources.booleanValue("media.verifyImageHeaders", "verifyImageHeaders", true),
            sources.booleanValue("media.recoveryEnabled", "recoveryEnabled", true)
        );
    }

    public EngineSettings withBatchSize(int size) {
        return new EngineSettings(size, itemTimeout, albumPageSize, maxVideoDuration,
            placeholderFallback, verifyImageHeaders, recoveryEnabled);
    }

    public EngineSettings withItemTimeout(Duration timeout) {
        return new EngineSettings(batchSize, timeout, albumPageSize, maxVideoDuration,
            placeholderFallback, verifyImageHeaders, recoveryEnabled);
    }

    public EngineSettings withAlbumPageSize(int pageSize) {
        return new EngineSettings(batchSize, itemTimeout, pageSize, maxVideoDuration,
            placeholderFallback, verifyImageHeaders, recoveryEnabled);
    }

    public EngineSettings withPlaceholderFallback(boolean enabled) {
        return new EngineSettings(batchSize, itemTimeout, albumPageSize, maxVideoDuration,
            enabled, verifyImageHeaders, recoveryEnabled);
    }

    public EngineSettings withRecoveryEnabled(boolean enabled) {
        return new EngineSettings(batchSize, itemTimeout, albumPageSize, maxVideoDuration,
            placeholderFallback, verifyImageHeaders, enabled);
    }
}
