package com.echopost.media.core.model;

/**
 * Why a stored media reference could not be used.
 */
public enum FailureReason {
    NOT_FOUND("NotFound"),
    PERMISSION_DENIED("PermissionDenied"),
    EMPTY("Empty"),
    UNSUPPORTED("Unsupported");

    private final String label;

    FailureReason(String label) {
        this.label = label;
    }

    /** Name used in serialized results. */
    public String label() {
        return label;
    }
}
