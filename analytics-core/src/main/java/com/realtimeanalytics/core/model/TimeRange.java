package com.realtimeanalytics.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval {@code [start, end]}.
 *
 * @since 1.0.0
 */
public final class TimeRange {

    private final Instant start;
    private final Instant end;

    /**
     * @param start inclusive start
     * @param end   inclusive end; must not precede {@code start}
     * @throws IllegalArgumentException if {@code end} is before {@code start}
     */
    public TimeRange(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    public static TimeRange of(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeRange that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
