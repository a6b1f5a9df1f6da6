package com.gridintel.ingest.service;

import com.gridintel.ingest.model.AggregateRecord;
import com.gridintel.ingest.model.AuditReport;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.DayAudit;
import com.gridintel.ingest.model.MissingRange;
import com.gridintel.ingest.model.RawRecord;
import com.gridintel.ingest.model.TimeRange;
import com.gridintel.ingest.store.PartitionedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Compares what the store holds against what a complete day should hold.
 *
 * Read-only. The current civil day is only expected up to "now" in the dataset zone,
 * and days after today are expected to be empty.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConsistencyAuditor {

    private final PartitionedStore store;
    private final Clock clock;

    public AuditReport audit(Dataset dataset, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Audit range ends before it starts: " + from + ".." + to);
        }
        log.info("Auditing {} from {} to {}", dataset.getId(), from, to);

        LocalDateTime now = LocalDateTime.now(clock.withZone(dataset.getZone()));

        Map<LocalDate, List<AggregateRecord>> aggregatesByDate = dataset.isAggregationEnabled()
                ? store.readAggregates(dataset, from, to).stream()
                        .collect(Collectors.groupingBy(AggregateRecord::getTradeDate))
                : Map.of();

        List<DayAudit> days = new ArrayList<>();
        Set<LocalDate> rawOnly = new TreeSet<>();
        Set<LocalDate> aggregateOnly = new TreeSet<>();
        LocalDateTime first = null;
        LocalDateTime last = null;

        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            List<RawRecord> raw = store.readRaw(dataset, TimeRange.ofDays(date, date));
            List<AggregateRecord> aggregates = aggregatesByDate.getOrDefault(date, List.of());

            DayAudit day = auditDay(dataset, date, raw, aggregates, now);
            days.add(day);

            if (dataset.isAggregationEnabled()) {
                if (!raw.isEmpty() && aggregates.isEmpty()) rawOnly.add(date);
                if (raw.isEmpty() && !aggregates.isEmpty()) aggregateOnly.add(date);
            }
            if (!raw.isEmpty()) {
                if (first == null) first = raw.get(0).getTimestamp();
                last = raw.get(raw.size() - 1).getTimestamp();
            }

            if (!day.isComplete()) {
                log.debug("{} {}: raw {}/{}, aggregates {}/{}, {} missing range(s)",
                        dataset.getId(), date, day.getRawCount(), day.getExpectedRawCount(),
                        day.getAggregateCount(), day.getExpectedAggregateCount(), day.getMissingRanges().size());
            }
        }

        AuditReport report = AuditReport.builder()
                .datasetId(dataset.getId())
                .from(from)
                .to(to)
                .days(days)
                .rawOnlyDates(rawOnly)
                .aggregateOnlyDates(aggregateOnly)
                .firstRecord(first)
                .lastRecord(last)
                .build();

        log.info("Audit {} {}..{}: {}/{} raw record(s) ({}%), {} incomplete day(s)",
                dataset.getId(), from, to, report.totalRawCount(), report.totalExpectedRawCount(),
                String.format("%.2f", report.completenessPercent()), report.incompleteDays().size());
        return report;
    }

    DayAudit auditDay(Dataset dataset, LocalDate date, List<RawRecord> raw,
                      List<AggregateRecord> aggregates, LocalDateTime now) {
        LocalDateTime dayStart = date.atStartOfDay();
        LocalDateTime dayEnd = date.plusDays(1).atStartOfDay();
        LocalDateTime gridEnd = now.isBefore(dayEnd) ? now : dayEnd;

        long expectedRaw = countGridPoints(dayStart, gridEnd, dataset.getResolution());
        long expectedAggregates = dataset.isAggregationEnabled()
                ? countGridPoints(dayStart, gridEnd, dataset.getAggregateInterval())
                : 0;

        return DayAudit.builder()
                .date(date)
                .rawCount(raw.size())
                .expectedRawCount(expectedRaw)
                .aggregateCount(aggregates.size())
                .expectedAggregateCount(expectedAggregates)
                .nullCounts(nullCounts(dataset, raw, aggregates))
                .missingRanges(missingRanges(raw, dayStart, gridEnd, dataset.getResolution()))
                .build();
    }

    /**
     * Walks the resolution grid of {@code [start, end)} and reports every run of grid
     * timestamps with no record as one range.
     */
    static List<MissingRange> missingRanges(List<RawRecord> raw, LocalDateTime start, LocalDateTime end,
                                            Duration resolution) {
        Set<LocalDateTime> present = new HashSet<>();
        for (RawRecord record : raw) {
            present.add(record.getTimestamp());
        }

        List<MissingRange> ranges = new ArrayList<>();
        LocalDateTime runStart = null;
        long runCount = 0;
        for (LocalDateTime t = start; t.isBefore(end); t = t.plus(resolution)) {
            if (present.contains(t)) {
                if (runStart != null) {
                    ranges.add(new MissingRange(runStart, t, runCount));
                    runStart = null;
                    runCount = 0;
                }
            } else {
                if (runStart == null) runStart = t;
                runCount++;
            }
        }
        if (runStart != null) {
            ranges.add(new MissingRange(runStart, runStart.plus(resolution.multipliedBy(runCount)), runCount));
        }
        return ranges;
    }

    private static long countGridPoints(LocalDateTime start, LocalDateTime end, Duration step) {
        if (!start.isBefore(end)) return 0;
        long elapsed = Duration.between(start, end).toSeconds();
        long stepSeconds = step.toSeconds();
        return (elapsed + stepSeconds - 1) / stepSeconds;
    }

    private static Map<String, Long> nullCounts(Dataset dataset, List<RawRecord> raw,
                                                List<AggregateRecord> aggregates) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String field : dataset.getValueFields()) {
            long nulls = raw.stream().filter(r -> r.value(field) == null).count();
            if (nulls > 0) counts.put(field, nulls);
        }

        long mean = aggregates.stream().filter(a -> a.getMean() == null).count();
        long median = aggregates.stream().filter(a -> a.getMedian() == null).count();
        long last = aggregates.stream().filter(a -> a.getLastObserved() == null).count();
        if (mean > 0) counts.put("mean_value", mean);
        if (median > 0) counts.put("median_value", median);
        if (last > 0) counts.put("last_observed", last);
        return counts;
    }
}
