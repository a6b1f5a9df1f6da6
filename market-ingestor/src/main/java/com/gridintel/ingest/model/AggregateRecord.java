package com.gridintel.ingest.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Rolled-up statistics for one fixed interval of one civil day.
 * Natural key is (dataset, tradeDate, intervalLabel, groupingKey).
 */
@Value
@Builder
public class AggregateRecord {

    LocalDate tradeDate;

    /** "HH:mm-HH:mm", e.g. "00:00-00:15"; the last interval of the day ends "00:00". */
    String intervalLabel;

    LocalDateTime intervalStart;

    String groupingKey;

    /** Raw records in the interval with a non-null aggregate field. */
    int sampleCount;

    // Null when every raw value in the interval was NULL
    Double mean;
    Double median;

    /** Non-null value of the raw record with the greatest timestamp in the interval. */
    Double lastObserved;
}
