package com.gridintel.ingest.model;

import java.time.LocalDateTime;

/**
 * Contiguous run of absent expected timestamps, {@code [start, end)}.
 */
public record MissingRange(LocalDateTime start, LocalDateTime end, long count) {

    @Override
    public String toString() {
        return "[" + start + ", " + end + ") x" + count;
    }
}
