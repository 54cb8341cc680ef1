package com.echopost.media.core.source;

/**
 * Raised by a {@link MediaIndex} when an album or query cannot be read.
 */
public class MediaIndexException extends Exception {
    public MediaIndexException(String message) {
        super(message);
    }

    public MediaIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
