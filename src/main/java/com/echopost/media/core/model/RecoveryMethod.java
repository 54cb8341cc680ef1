package com.echopost.media.core.model;

/**
 * How an effective URI was obtained for a validated reference.
 */
public enum RecoveryMethod {
    /** The original reference was still live. */
    NONE,
    EXACT_FILENAME,
    FILENAME_PATTERN,
    /** Matched by creation time and byte size. */
    METADATA
}
