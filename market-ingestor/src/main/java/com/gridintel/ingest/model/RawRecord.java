package com.gridintel.ingest.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One measurement as persisted in a raw partition.
 *
 * Natural key is (dataset, timestamp, groupingKey). Value fields are keyed by the
 * column names the dataset declares; a present key with a null value is stored as NULL.
 */
@Value
@Builder(toBuilder = true)
public class RawRecord {

    /** Naive local time in the dataset's civil zone, never shifted after assignment. */
    LocalDateTime timestamp;

    /** Country / bidding-zone code used for partition routing, e.g. "CZ". */
    String groupingKey;

    Map<String, Double> values;

    public Double value(String field) {
        return values == null ? null : values.get(field);
    }

    public Map<String, Double> getValues() {
        return values == null ? Map.of() : Collections.unmodifiableMap(values);
    }

    public static RawRecord of(LocalDateTime timestamp, String groupingKey, String field, Double value) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(field, value);
        return new RawRecord(timestamp, groupingKey, values);
    }
}
