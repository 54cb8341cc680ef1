package com.echopost.media.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Inclusive creation-time window.
 */
public record DateRange(Instant start, Instant end) {
    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Date range end " + end + " precedes start " + start);
        }
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }
}
