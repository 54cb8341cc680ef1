package com.echopost.media.core.format;

/**
 * Checks leading magic bytes against the declared image type.
 * Types without a reliable signature here (HEIC/HEIF, all video) always pass.
 */
public final class MediaHeaderInspector {
    /** Bytes callers should read before calling {@link #matches(byte[], String)}. */
    public static final int HEADER_LENGTH = 12;

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A};

    private MediaHeaderInspector() {
    }

    public static boolean matches(byte[] header, String mimeType) {
        if (mimeType == null || !mimeType.startsWith("image/")) {
            return true;
        }
        if (header == null || header.length < 8) {
            return false;
        }
        return switch (mimeType) {
            case "image/jpeg" -> unsigned(header[0]) == 0xFF && unsigned(header[1]) == 0xD8 && unsigned(header[2]) == 0xFF;
            case "image/png" -> startsWith(header, PNG_SIGNATURE);
            case "image/gif" -> header[0] == 'G' && header[1] == 'I' && header[2] == 'F' && header[3] == '8'
                && (header[4] == '7' || header[4] == '9') && header[5] == 'a';
            case "image/bmp" -> header[0] == 'B' && header[1] == 'M';
            case "image/webp" -> header.length >= 12
                && header[0] == 'R' && header[1] == 'I' && header[2] == 'F' && header[3] == 'F'
                && header[8] == 'W' && header[9] == 'E' && header[10] == 'B' && header[11] == 'P';
            case "image/tiff" -> (header[0] == 'I' && header[1] == 'I' && header[2] == 0x2A && header[3] == 0x00)
                || (header[0] == 'M' && header[1] == 'M' && header[2] == 0x00 && header[3] == 0x2A);
            default -> true;
        };
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static int unsigned(byte value) {
        return value & 0xFF;
    }
}
