package com.photosync.model;

import java.time.Instant;

/**
 * A user supplied date range. Either bound may be null, meaning epoch or now respectively.
 */
public class TimeRange {
    private final Instant start;
    private final Instant end;

    public TimeRange(Instant start, Instant end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public Instant getStart() { return start; }
    public Instant getEnd() { return end; }
}
