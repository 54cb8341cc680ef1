package com.echopost.media.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating a previously recorded media reference.
 */
public record ValidationResult(boolean isValid,
                               String originalUri,
                               String effectiveUri,
                               FailureReason failureReason,
                               RecoveryMethod recoveryMethod) {
    public ValidationResult {
        Objects.requireNonNull(originalUri, "originalUri");
        if (isValid && failureReason != null) {
            throw new IllegalArgumentException("A valid result cannot carry a failure reason");
        }
        if (!isValid && failureReason == null) {
            throw new IllegalArgumentException("An invalid result needs a failure reason");
        }
    }

    public static ValidationResult live(String uri) {
        return new ValidationResult(true, uri, uri, null, RecoveryMethod.NONE);
    }

    public static ValidationResult recovered(String originalUri, String recoveredUri, RecoveryMethod method) {
        return new ValidationResult(true, originalUri, recoveredUri, null, method);
    }

    public static ValidationResult failed(String uri, FailureReason reason) {
        return new ValidationResult(false, uri, uri, reason, null);
    }

    public boolean wasRecovered() {
        return isValid && recoveryMethod != RecoveryMethod.NONE;
    }

    public Optional<FailureReason> optionalFailureReason() {
        return Optional.ofNullable(failureReason);
    }
}
