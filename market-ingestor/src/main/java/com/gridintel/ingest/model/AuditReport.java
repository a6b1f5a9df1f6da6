package com.gridintel.ingest.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only consistency report for one dataset over a range of civil days.
 */
@Value
@Builder
public class AuditReport {

    String datasetId;
    LocalDate from;
    LocalDate to;
    List<DayAudit> days;

    /** Trade dates with raw rows but no aggregate rows. */
    Set<LocalDate> rawOnlyDates;

    /** Trade dates with aggregate rows but no raw rows. */
    Set<LocalDate> aggregateOnlyDates;

    LocalDateTime firstRecord;
    LocalDateTime lastRecord;

    public long totalRawCount() {
        return days.stream().mapToLong(DayAudit::getRawCount).sum();
    }

    public long totalExpectedRawCount() {
        return days.stream().mapToLong(DayAudit::getExpectedRawCount).sum();
    }

    public double completenessPercent() {
        long expected = totalExpectedRawCount();
        return expected == 0 ? 100.0 : totalRawCount() * 100.0 / expected;
    }

    public List<DayAudit> incompleteDays() {
        return days.stream().filter(d -> !d.isComplete()).collect(Collectors.toList());
    }
}
