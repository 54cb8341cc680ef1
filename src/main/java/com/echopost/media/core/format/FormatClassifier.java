package com.echopost.media.core.format;

import com.echopost.media.core.model.MediaKind;

import java.util.Locale;
import java.util.Map;

/**
 * Maps file names to MIME types against the fixed image and video allow-lists.
 */
public final class FormatClassifier {
    public static final String UNKNOWN_MIME_TYPE = "application/octet-stream";

    private static final Map<String, String> IMAGE_TYPES = Map.ofEntries(
        Map.entry("jpg", "image/jpeg"),
        Map.entry("jpeg", "image/jpeg"),
        Map.entry("png", "image/png"),
        Map.entry("gif", "image/gif"),
        Map.entry("bmp", "image/bmp"),
        Map.entry("webp", "image/webp"),
        Map.entry("heic", "image/heic"),
        Map.entry("heif", "image/heif"),
        Map.entry("tiff", "image/tiff"),
        Map.entry("tif", "image/tiff")
    );

    private static final Map<String, String> VIDEO_TYPES = Map.ofEntries(
        Map.entry("mp4", "video/mp4"),
        Map.entry("mov", "video/quicktime"),
        Map.entry("avi", "video/x-msvideo"),
        Map.entry("mkv", "video/x-matroska"),
        Map.entry("webm", "video/webm"),
        Map.entry("m4v", "video/x-m4v"),
        Map.entry("3gp", "video/3gpp"),
        Map.entry("flv", "video/x-flv"),
        Map.entry("wmv", "video/x-ms-wmv"),
        Map.entry("mpg", "video/mpeg"),
        Map.entry("mpeg", "video/mpeg")
    );

    private FormatClassifier() {
    }

    public static FormatVerdict classify(String path) {
        String extension = extensionOf(path);
        String image = IMAGE_TYPES.get(extension);
        if (image != null) {
            return new FormatVerdict(image, true, MediaKind.PHOTO);
        }
        String video = VIDEO_TYPES.get(extension);
        if (video != null) {
            return new FormatVerdict(video, true, MediaKind.VIDEO);
        }
        return FormatVerdict.unsupported();
    }

    public static boolean isSupported(String path) {
        return classify(path).supported();
    }

    public static boolean isSupportedMimeType(String mimeType) {
        return mimeType != null && (IMAGE_TYPES.containsValue(mimeType) || VIDEO_TYPES.containsValue(mimeType));
    }

    static String extensionOf(String path) {
        if (path == null) {
            return "";
        }
        String name = path;
        int query = name.indexOf('?');
        if (query >= 0) {
            name = name.substring(0, query);
        }
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
