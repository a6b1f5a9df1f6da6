package com.gridintel.ingest.store;

import com.gridintel.ingest.model.PartitionGranularity;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Physical placement of a record: base table, raw or aggregate, grouping key and,
 * depending on granularity, the year or month the record falls in.
 *
 * Computed from the record alone, never from what is already stored.
 */
public record PartitionKey(String baseTable, Kind kind, String groupingKey,
                           PartitionGranularity granularity, LocalDate periodStart) {

    private static final DateTimeFormatter YEAR = DateTimeFormatter.ofPattern("yyyy");
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyyMM");

    public enum Kind {
        RAW("raw"),
        AGGREGATE("agg");

        private final String suffix;

        Kind(String suffix) {
            this.suffix = suffix;
        }
    }

    /** e.g. ceps_imbalance_raw_cz_202511 */
    public String tableName() {
        String name = baseTable + "_" + kind.suffix + "_" + groupingKey.toLowerCase(Locale.ROOT);
        return switch (granularity) {
            case NONE -> name;
            case YEAR -> name + "_" + YEAR.format(periodStart);
            case MONTH -> name + "_" + MONTH.format(periodStart);
        };
    }

    @Override
    public String toString() {
        return tableName();
    }
}
