package com.gridintel.ingest.model;

import java.time.LocalDateTime;

/**
 * What the next auto-mode run should fetch.
 *
 * @param range       the missing range, possibly empty
 * @param cursor      maximum persisted timestamp, or null for an empty store
 * @param nothingToDo true when the dataset is already caught up to now minus lag
 */
public record BackfillResolution(TimeRange range, LocalDateTime cursor, boolean nothingToDo) {

    public static BackfillResolution pending(TimeRange range, LocalDateTime cursor) {
        return new BackfillResolution(range, cursor, false);
    }

    public static BackfillResolution upToDate(LocalDateTime from, LocalDateTime cursor) {
        return new BackfillResolution(TimeRange.of(from, from), cursor, true);
    }
}
