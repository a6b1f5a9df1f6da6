package com.gridintel.ingest.fetch;

import com.gridintel.ingest.config.IngestorProperties;
import com.gridintel.ingest.exception.RecordParseException;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.RawRecord;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Config-driven parser: picks the timestamp, grouping key and value columns out of a row
 * by name.
 *
 * Timestamps matching the configured pattern are taken as local time already. Values
 * carrying an offset (e.g. {@code 2025-11-01T00:00:00+01:00}) are shifted into the
 * dataset's zone first, then stripped. Blank value cells become nulls.
 */
public class FieldMappingRecordParser implements RecordParser {

    private final IngestorProperties.Source source;
    private final DateTimeFormatter timestampFormat;

    public FieldMappingRecordParser(IngestorProperties.Source source) {
        this.source = source;
        this.timestampFormat = DateTimeFormatter.ofPattern(source.getTimestampPattern());
    }

    @Override
    public RawRecord parse(RawFields row, Dataset dataset) throws RecordParseException {
        LocalDateTime timestamp = parseTimestamp(row, dataset);
        String groupingKey = groupingKey(row, dataset);

        Map<String, Double> values = new LinkedHashMap<>();
        for (String field : dataset.getValueFields()) {
            values.put(field, parseValue(row, field, columnFor(field)));
        }

        return RawRecord.builder()
                .timestamp(timestamp)
                .groupingKey(groupingKey)
                .values(values)
                .build();
    }

    private LocalDateTime parseTimestamp(RawFields row, Dataset dataset) throws RecordParseException {
        String raw = row.field(source.getTimestampField());
        if (raw == null || raw.isBlank()) {
            throw new RecordParseException("Missing timestamp column '" + source.getTimestampField() + "' in " + row);
        }
        String text = raw.trim();
        try {
            return LocalDateTime.parse(text, timestampFormat);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text)
                        .atZoneSameInstant(dataset.getZone())
                        .toLocalDateTime();
            } catch (DateTimeParseException ignored) {
                throw new RecordParseException("Unparseable timestamp '" + text + "' in " + row, e);
            }
        }
    }

    private String groupingKey(RawFields row, Dataset dataset) {
        if (source.getGroupingKeyField() == null) return dataset.getGroupingKey();

        String raw = row.field(source.getGroupingKeyField());
        if (raw == null || raw.isBlank()) return dataset.getGroupingKey();
        return raw.trim().toUpperCase();
    }

    /** Upstream column that feeds {@code field}; the field name itself when unmapped. */
    private String columnFor(String field) {
        for (Map.Entry<String, String> mapping : source.getFieldMapping().entrySet()) {
            if (mapping.getValue().equals(field)) return mapping.getKey();
        }
        return field;
    }

    private static Double parseValue(RawFields row, String field, String column) throws RecordParseException {
        String raw = row.field(column);
        if (raw == null || raw.isBlank()) return null;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new RecordParseException("Non-numeric value '" + raw + "' for " + field + " in " + row, e);
        }
    }
}
