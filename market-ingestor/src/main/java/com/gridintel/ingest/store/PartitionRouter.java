package com.gridintel.ingest.store;

import com.gridintel.ingest.exception.PartitionRoutingException;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.PartitionGranularity;
import com.gridintel.ingest.model.RawRecord;
import com.gridintel.ingest.model.TimeRange;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps records to partitions. Pure functions of the record and the dataset definition.
 */
@Component
public class PartitionRouter {

    public PartitionKey route(Dataset dataset, PartitionKey.Kind kind, String groupingKey, LocalDate date) {
        if (groupingKey == null || !dataset.getGroupingDomain().contains(groupingKey)) {
            throw new PartitionRoutingException(String.format(
                    "%s: grouping key '%s' is outside the declared domain %s of table %s",
                    dataset.getId(), groupingKey, dataset.getGroupingDomain(), dataset.getTable()));
        }
        PartitionGranularity granularity = dataset.getPartitionGranularity();
        return new PartitionKey(dataset.getTable(), kind, groupingKey, granularity, periodStart(granularity, date));
    }

    public PartitionKey routeRaw(Dataset dataset, RawRecord record) {
        return route(dataset, PartitionKey.Kind.RAW, record.getGroupingKey(), record.getTimestamp().toLocalDate());
    }

    /**
     * Groups a batch by partition. Every record is routed before anything is returned,
     * so one bad grouping key rejects the whole batch up front.
     */
    public Map<PartitionKey, List<RawRecord>> routeAll(Dataset dataset, List<RawRecord> records) {
        Map<PartitionKey, List<RawRecord>> routed = new TreeMap<>(
                (a, b) -> a.tableName().compareTo(b.tableName()));
        for (RawRecord record : records) {
            routed.computeIfAbsent(routeRaw(dataset, record), k -> new ArrayList<>()).add(record);
        }
        return routed;
    }

    /** Partitions of the dataset's own grouping key that can hold rows of {@code range}, oldest first. */
    public List<PartitionKey> partitionsCovering(Dataset dataset, PartitionKey.Kind kind, TimeRange range) {
        List<PartitionKey> keys = new ArrayList<>();
        if (range.isEmpty()) return keys;

        // Exclusive end: a range ending at midnight doesn't reach into the next day
        LocalDate first = range.start().toLocalDate();
        LocalDate last = range.end().minusNanos(1).toLocalDate();

        PartitionGranularity granularity = dataset.getPartitionGranularity();
        LocalDate period = periodStart(granularity, first);
        while (!period.isAfter(last)) {
            keys.add(route(dataset, kind, dataset.getGroupingKey(), period));
            if (granularity == PartitionGranularity.NONE) break;
            period = granularity == PartitionGranularity.YEAR ? period.plusYears(1) : period.plusMonths(1);
        }
        return keys;
    }

    public List<PartitionKey> partitionsCovering(Dataset dataset, PartitionKey.Kind kind, LocalDate from, LocalDate to) {
        return partitionsCovering(dataset, kind, TimeRange.ofDays(from, to));
    }

    static LocalDate periodStart(PartitionGranularity granularity, LocalDate date) {
        return switch (granularity) {
            case NONE -> LocalDate.EPOCH;
            case YEAR -> date.withDayOfYear(1);
            case MONTH -> date.withDayOfMonth(1);
        };
    }
}
