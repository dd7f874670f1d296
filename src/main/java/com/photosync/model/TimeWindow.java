package com.photosync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An interval bounding one metadata listing request.
 * Bounds carry their own inclusiveness so that the heuristic windows
 * [epoch, oldest) and (newest, now] can be expressed exactly.
 */
public class TimeWindow {
    private final Instant start;
    private final boolean startInclusive;
    private final Instant end;
    private final boolean endInclusive;

    public TimeWindow(Instant start, boolean startInclusive, Instant end, boolean endInclusive) {
        this.start = Objects.requireNonNull(start, "start");
        this.startInclusive = startInclusive;
        this.end = Objects.requireNonNull(end, "end");
        this.endInclusive = endInclusive;
    }

    public static TimeWindow closed(Instant start, Instant end) {
        return new TimeWindow(start, true, end, true);
    }

    public Instant getStart() { return start; }
    public boolean isStartInclusive() { return startInclusive; }
    public Instant getEnd() { return end; }
    public boolean isEndInclusive() { return endInclusive; }

    public boolean contains(Instant instant) {
        int lower = instant.compareTo(start);
        int upper = instant.compareTo(end);
        return (startInclusive ? lower >= 0 : lower > 0) && (endInclusive ? upper <= 0 : upper < 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeWindow)) return false;
        TimeWindow other = (TimeWindow) o;
        return startInclusive == other.startInclusive && endInclusive == other.endInclusive
                && start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, startInclusive, end, endInclusive);
    }

    @Override
    public String toString() {
        return (startInclusive ? "[" : "(") + start + ", " + end + (endInclusive ? "]" : ")");
    }
}
