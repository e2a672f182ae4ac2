package com.campusevents.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval [start, end) used for booking overlap checks.
 * Back-to-back ranges (one ends exactly when the next starts) do not overlap.
 */
public final class TimeRange {

    private final Instant start;
    private final Instant end;

    private TimeRange(Instant start, Instant end) {
        this.start = start;
        this.end = end;
    }

    public static TimeRange of(Instant start, Instant end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        return new TimeRange(start, end);
    }

    public static boolean overlaps(Instant start1, Instant end1, Instant start2, Instant end2) {
        return start1.isBefore(end2) && start2.isBefore(end1);
    }

    public boolean overlaps(TimeRange other) {
        return overlaps(start, end, other.start, other.end);
    }

    /**
     * True when this range lies inside [windowStart, windowEnd]. A null bound is open.
     */
    public boolean within(Instant windowStart, Instant windowEnd) {
        if (windowStart != null && start.isBefore(windowStart)) {
            return false;
        }
        return windowEnd == null || !end.isAfter(windowEnd);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
