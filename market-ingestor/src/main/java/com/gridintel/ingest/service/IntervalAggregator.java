package com.gridintel.ingest.service;

import com.gridintel.ingest.model.AggregateRecord;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.RawRecord;
import com.gridintel.ingest.model.TimeRange;
import com.gridintel.ingest.store.PartitionedStore;
import com.gridintel.ingest.store.UpsertResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Rolls raw records of one civil day up into fixed intervals.
 *
 * Buckets are {@code floor((ts - dayStart) / interval)}. Only intervals holding at
 * least one raw record are written; a missing aggregate row means "no raw data",
 * never zero. Statistics skip NULL values of the aggregate field. Results are always
 * recomputed from the current raw rows and upserted, so re-running a day is safe.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IntervalAggregator {

    private final PartitionedStore store;

    /** Recomputes and stores the aggregates of one trade date. */
    public int aggregate(Dataset dataset, LocalDate tradeDate) {
        if (!dataset.isAggregationEnabled()) {
            log.debug("{}: aggregation disabled, skipping {}", dataset.getId(), tradeDate);
            return 0;
        }

        List<RawRecord> raw = store.readRaw(dataset, TimeRange.ofDays(tradeDate, tradeDate));
        List<AggregateRecord> aggregates = computeDay(dataset, tradeDate, raw);
        UpsertResult result = store.upsertAggregates(dataset, aggregates);

        log.info("{}: aggregated {} raw record(s) on {} into {} interval(s) ({} new)",
                dataset.getId(), raw.size(), tradeDate, aggregates.size(), result.inserted());
        return aggregates.size();
    }

    /** Aggregates each date in turn, oldest first. */
    public long aggregate(Dataset dataset, Collection<LocalDate> tradeDates) {
        long written = 0;
        for (LocalDate date : new TreeSet<>(tradeDates)) {
            written += aggregate(dataset, date);
        }
        return written;
    }

    public long aggregateRange(Dataset dataset, LocalDate from, LocalDate to) {
        long written = 0;
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            written += aggregate(dataset, date);
        }
        return written;
    }

    /**
     * Pure roll-up of {@code raw} for {@code tradeDate}. Records outside the day are
     * ignored. Output is ordered by interval start.
     */
    public List<AggregateRecord> computeDay(Dataset dataset, LocalDate tradeDate, List<RawRecord> raw) {
        Duration interval = dataset.getAggregateInterval();
        LocalDateTime dayStart = tradeDate.atStartOfDay();
        TimeRange day = TimeRange.ofDays(tradeDate, tradeDate);
        String field = dataset.getAggregateField();

        Map<Long, List<RawRecord>> buckets = new TreeMap<>();
        for (RawRecord record : raw) {
            if (!day.contains(record.getTimestamp())) continue;
            long bucket = Duration.between(dayStart, record.getTimestamp()).toSeconds() / interval.toSeconds();
            buckets.computeIfAbsent(bucket, k -> new ArrayList<>()).add(record);
        }

        List<AggregateRecord> aggregates = new ArrayList<>(buckets.size());
        for (Map.Entry<Long, List<RawRecord>> entry : buckets.entrySet()) {
            LocalDateTime intervalStart = dayStart.plus(interval.multipliedBy(entry.getKey()));

            List<Double> values = new ArrayList<>();
            LocalDateTime lastTs = null;
            Double last = null;
            for (RawRecord record : entry.getValue()) {
                Double value = record.value(field);
                if (value == null) continue;
                values.add(value);
                if (lastTs == null || record.getTimestamp().isAfter(lastTs)) {
                    lastTs = record.getTimestamp();
                    last = value;
                }
            }

            aggregates.add(AggregateRecord.builder()
                    .tradeDate(tradeDate)
                    .intervalLabel(IntervalStatistics.label(intervalStart.toLocalTime(), interval))
                    .intervalStart(intervalStart)
                    .groupingKey(dataset.getGroupingKey())
                    .sampleCount(values.size())
                    .mean(IntervalStatistics.mean(values))
                    .median(IntervalStatistics.median(values))
                    .lastObserved(last)
                    .build());
        }
        return aggregates;
    }
}
