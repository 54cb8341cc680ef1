package com.echopost.media.core.source;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.GpsDirectory;
import com.drew.metadata.mov.QuickTimeDirectory;
import com.drew.metadata.mp4.Mp4Directory;
import com.echopost.media.core.model.GeoPoint;
import com.echopost.media.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads GPS position, EXIF orientation and container duration through metadata-extractor.
 * Files it cannot parse yield {@link EmbeddedMetadata#NONE}.
 */
final class EmbeddedMetadataReader {

    private static final Logger LOGGER = AppLogger.get();

    private EmbeddedMetadataReader() {
    }

    static EmbeddedMetadata read(Path file) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(file.toFile());
        } catch (ImageProcessingException | IOException | RuntimeException e) {
            LOGGER.log(Level.FINE, e, () -> "No embedded metadata in " + file);
            return EmbeddedMetadata.NONE;
        }
        return new EmbeddedMetadata(location(metadata), duration(metadata), orientation(metadata));
    }

    private static GeoPoint location(Metadata metadata) {
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        if (gps == null) {
            return null;
        }
        GeoLocation geo = gps.getGeoLocation();
        if (geo == null || geo.isZero()) {
            return null;
        }
        return new GeoPoint(geo.getLatitude(), geo.getLongitude());
    }

    private static int orientation(Metadata metadata) {
        ExifIFD0Directory exif = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        if (exif == null) {
            return 0;
        }
        Integer value = exif.getInteger(ExifIFD0Directory.TAG_ORIENTATION);
        return value == null || value < 1 || value > 8 ? 0 : value;
    }

    private static Duration duration(Metadata metadata) {
        Duration mp4 = duration(metadata.getFirstDirectoryOfType(Mp4Directory.class),
            Mp4Directory.TAG_DURATION, Mp4Directory.TAG_TIME_SCALE);
        if (!mp4.isZero()) {
            return mp4;
        }
        return duration(metadata.getFirstDirectoryOfType(QuickTimeDirectory.class),
            QuickTimeDirectory.TAG_DURATION, QuickTimeDirectory.TAG_TIME_SCALE);
    }

    // movie header stores the length in time-scale units
    private static Duration duration(Directory directory, int durationTag, int scaleTag) {
        if (directory == null) {
            return Duration.ZERO;
        }
        Long units = directory.getLongObject(durationTag);
        Long scale = directory.getLongObject(scaleTag);
        if (units == null || scale == null || units <= 0 || scale <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(units * 1000 / scale);
    }
}
