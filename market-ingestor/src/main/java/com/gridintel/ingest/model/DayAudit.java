package com.gridintel.ingest.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class DayAudit {

    LocalDate date;
    long rawCount;
    long expectedRawCount;
    long aggregateCount;
    long expectedAggregateCount;

    /** NULL occurrences per column, raw value fields and aggregate statistics alike. */
    Map<String, Long> nullCounts;

    List<MissingRange> missingRanges;

    public boolean isComplete() {
        return rawCount >= expectedRawCount
                && aggregateCount >= expectedAggregateCount
                && missingRanges.isEmpty()
                && nullCounts.isEmpty();
    }

    public long missingCount() {
        return missingRanges.stream().mapToLong(MissingRange::count).sum();
    }
}
