package com.gridintel.ingest.service;

import com.gridintel.ingest.model.TimeRange;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.stream.Stream;

/**
 * Splits a range into consecutive sub-ranges no longer than an upstream's maximum
 * query span, oldest first.
 *
 * Chunks are produced lazily, so a multi-year backfill never materialises its plan.
 * Consecutive chunks share their boundary: chunk n ends exactly where chunk n+1 starts.
 */
@Component
public class ChunkPlanner {

    public Stream<TimeRange> plan(TimeRange range, Duration maxSpan) {
        if (maxSpan == null || maxSpan.isZero() || maxSpan.isNegative()) {
            throw new IllegalArgumentException("maxSpan must be positive: " + maxSpan);
        }
        if (range.isEmpty()) {
            return Stream.empty();
        }
        LocalDateTime end = range.end();
        return Stream.iterate(range.start(), start -> start.isBefore(end), start -> chunkEnd(start, end, maxSpan))
                .map(start -> TimeRange.of(start, chunkEnd(start, end, maxSpan)));
    }

    /** Number of chunks {@link #plan} will yield, without producing them. */
    public long chunkCount(TimeRange range, Duration maxSpan) {
        if (range.isEmpty()) return 0;
        long total = range.length().toNanos();
        long span = maxSpan.toNanos();
        return (total + span - 1) / span;
    }

    private static LocalDateTime chunkEnd(LocalDateTime start, LocalDateTime end, Duration maxSpan) {
        // Compare before adding so an enormous span can't overflow LocalDateTime
        return Duration.between(start, end).compareTo(maxSpan) <= 0 ? end : start.plus(maxSpan);
    }
}
