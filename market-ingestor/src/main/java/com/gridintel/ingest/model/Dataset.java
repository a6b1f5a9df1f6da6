package com.gridintel.ingest.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;

/**
 * A named time series: identity is (source, resource, groupingKey).
 * Built and validated by {@link com.gridintel.ingest.service.DatasetRegistry}.
 */
@Value
@Builder
public class Dataset {

    String id;
    String source;
    String resource;
    String groupingKey;

    /** Grouping keys the physical table accepts; anything else is a routing error. */
    @Singular("groupingDomainKey")
    Set<String> groupingDomain;

    /** Base name of the physical tables, e.g. "ceps_imbalance". */
    String table;

    ZoneId zone;
    Duration resolution;

    /** Zero disables aggregation for this dataset. */
    Duration aggregateInterval;

    Duration maxChunkSpan;
    Duration lag;
    LocalDateTime epochFloor;

    @Singular
    List<String> valueFields;

    String aggregateField;
    PartitionGranularity partitionGranularity;

    public boolean isAggregationEnabled() {
        return aggregateInterval != null && !aggregateInterval.isZero();
    }

    /** Raw records in one complete civil day, e.g. 1440 at one-minute resolution. */
    public long expectedRecordsPerDay() {
        return Duration.ofDays(1).dividedBy(resolution);
    }

    public long expectedIntervalsPerDay() {
        return isAggregationEnabled() ? Duration.ofDays(1).dividedBy(aggregateInterval) : 0;
    }

    @Override
    public String toString() {
        return id + " (" + source + "/" + resource + "/" + groupingKey + ")";
    }
}
