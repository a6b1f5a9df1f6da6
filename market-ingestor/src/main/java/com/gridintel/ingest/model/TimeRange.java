package com.gridintel.ingest.model;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open range {@code [start, end)} of naive local timestamps.
 * An inverted or zero-length range is empty; it is never an error to hold one.
 */
public record TimeRange(LocalDateTime start, LocalDateTime end) {

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static TimeRange of(LocalDateTime start, LocalDateTime end) {
        return new TimeRange(start, end);
    }

    /** Whole civil days, {@code firstDay} 00:00 up to the day after {@code lastDay}. */
    public static TimeRange ofDays(LocalDate firstDay, LocalDate lastDay) {
        return new TimeRange(firstDay.atStartOfDay(), lastDay.plusDays(1).atStartOfDay());
    }

    public boolean isEmpty() {
        return !start.isBefore(end);
    }

    public boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(start) && timestamp.isBefore(end);
    }

    public Duration length() {
        return isEmpty() ? Duration.ZERO : Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
