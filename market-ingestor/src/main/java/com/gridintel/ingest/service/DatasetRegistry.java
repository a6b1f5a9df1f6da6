package com.gridintel.ingest.service;

import com.gridintel.ingest.config.IngestorProperties;
import com.gridintel.ingest.exception.InvalidDatasetException;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.PartitionGranularity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validated, immutable view of the configured datasets.
 *
 * Table and column names end up in DDL and DML text, so they are restricted to
 * lower-case SQL identifiers here, once, rather than escaped at every use.
 *
 * Partition tables carry no dataset column, so a (table, grouping key) pair may
 * belong to one dataset only.
 */
@Service
@Slf4j
public class DatasetRegistry {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]{0,29}");
    private static final Pattern GROUPING_KEY = Pattern.compile("[A-Za-z0-9]{1,16}");
    private static final Set<String> RESERVED_COLUMNS = Set.of(
            "ts", "grouping_key", "ingested_at", "value", "key", "year", "month", "day");

    private final Map<String, Dataset> datasets;

    public DatasetRegistry(IngestorProperties properties) {
        Map<String, Dataset> byId = new LinkedHashMap<>();
        Map<String, Dataset> owners = new HashMap<>();
        for (IngestorProperties.DatasetConfig config : properties.getDatasets()) {
            if (!config.isEnabled()) {
                log.info("Dataset {} is disabled, skipping", config.getId());
                continue;
            }
            Dataset dataset = toDataset(config, properties);
            if (byId.putIfAbsent(dataset.getId(), dataset) != null) {
                throw new InvalidDatasetException("Duplicate dataset id: " + dataset.getId());
            }
            for (String key : dataset.getGroupingDomain()) {
                Dataset owner = owners.putIfAbsent(dataset.getTable() + "/" + key, dataset);
                if (owner != null) {
                    throw new InvalidDatasetException(String.format(
                            "%s: table %s with grouping key %s is already used by dataset %s",
                            dataset.getId(), dataset.getTable(), key, owner.getId()));
                }
            }
        }
        this.datasets = Collections.unmodifiableMap(byId);
        log.info("Registered {} dataset(s): {}", datasets.size(), datasets.keySet());
    }

    public Dataset get(String id) {
        Dataset dataset = datasets.get(id);
        if (dataset == null) {
            throw new InvalidDatasetException("Unknown dataset: " + id + " (known: " + datasets.keySet() + ")");
        }
        return dataset;
    }

    public Collection<Dataset> all() {
        return datasets.values();
    }

    static Dataset toDataset(IngestorProperties.DatasetConfig config, IngestorProperties properties) {
        String id = require(config.getId(), "id", "?");
        String source = require(config.getSource(), "source", id);
        String resource = require(config.getResource(), "resource", id);
        String groupingKey = require(config.getGroupingKey(), "grouping-key", id).toUpperCase(Locale.ROOT);
        String table = require(config.getTable(), "table", id);

        if (!GROUPING_KEY.matcher(groupingKey).matches()) {
            throw new InvalidDatasetException(id + ": grouping-key must be alphanumeric: " + groupingKey);
        }
        if (!IDENTIFIER.matcher(table).matches()) {
            throw new InvalidDatasetException(id + ": table is not a valid identifier: " + table);
        }

        List<String> domain = new ArrayList<>();
        for (String key : config.getGroupingDomain()) {
            String normalised = key.trim().toUpperCase(Locale.ROOT);
            if (!GROUPING_KEY.matcher(normalised).matches()) {
                throw new InvalidDatasetException(id + ": grouping-domain entry is not alphanumeric: " + key);
            }
            domain.add(normalised);
        }
        if (domain.isEmpty()) {
            domain.add(groupingKey);
        } else if (!domain.contains(groupingKey)) {
            throw new InvalidDatasetException(id + ": grouping-key " + groupingKey + " is outside grouping-domain " + domain);
        }

        List<String> valueFields = config.getValueFields();
        if (valueFields.isEmpty()) {
            throw new InvalidDatasetException(id + ": at least one value field is required");
        }
        for (String field : valueFields) {
            if (!IDENTIFIER.matcher(field).matches() || RESERVED_COLUMNS.contains(field)) {
                throw new InvalidDatasetException(id + ": value field is not a usable column name: " + field);
            }
        }
        if (valueFields.stream().distinct().count() != valueFields.size()) {
            throw new InvalidDatasetException(id + ": duplicate value fields " + valueFields);
        }
        String aggregateField = config.getAggregateField() != null ? config.getAggregateField() : valueFields.get(0);
        if (!valueFields.contains(aggregateField)) {
            throw new InvalidDatasetException(id + ": aggregate-field " + aggregateField + " is not a value field");
        }

        Duration resolution = positive(config.getResolution(), "resolution", id);
        Duration maxChunkSpan = positive(config.getMaxChunkSpan(), "max-chunk-span", id);
        Duration lag = config.getLag() == null ? Duration.ZERO : config.getLag();
        if (lag.isNegative()) {
            throw new InvalidDatasetException(id + ": lag must not be negative");
        }
        if (resolution.toSeconds() == 0 || Duration.ofDays(1).toSeconds() % resolution.toSeconds() != 0) {
            throw new InvalidDatasetException(id + ": resolution must divide a day evenly: " + resolution);
        }
        Duration aggregateInterval = config.getAggregateInterval() == null ? Duration.ZERO : config.getAggregateInterval();
        if (!aggregateInterval.isZero()) {
            if (aggregateInterval.compareTo(resolution) < 0
                    || Duration.ofDays(1).toSeconds() % aggregateInterval.toSeconds() != 0) {
                throw new InvalidDatasetException(id + ": aggregate-interval must divide a day and be >= resolution: "
                        + aggregateInterval);
            }
        }

        ZoneId zone;
        try {
            zone = ZoneId.of(config.getZone());
        } catch (DateTimeException e) {
            throw new InvalidDatasetException(id + ": unknown zone " + config.getZone());
        }

        PartitionGranularity granularity = config.getPartitionGranularity() == null
                ? PartitionGranularity.MONTH
                : config.getPartitionGranularity();

        return Dataset.builder()
                .id(id)
                .source(source)
                .resource(resource)
                .groupingKey(groupingKey)
                .groupingDomain(domain)
                .table(table)
                .zone(zone)
                .resolution(resolution)
                .aggregateInterval(aggregateInterval)
                .maxChunkSpan(maxChunkSpan)
                .lag(lag)
                .epochFloor(config.getEpochFloor() != null ? config.getEpochFloor() : properties.getEpochFloor())
                .valueFields(valueFields)
                .aggregateField(aggregateField)
                .partitionGranularity(granularity)
                .build();
    }

    private static String require(String value, String name, String id) {
        if (value == null || value.isBlank()) {
            throw new InvalidDatasetException("Dataset " + id + ": " + name + " is required");
        }
        return value.trim();
    }

    private static Duration positive(Duration value, String name, String id) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new InvalidDatasetException(id + ": " + name + " must be positive");
        }
        return value;
    }

    public Set<String> ids() {
        return datasets.keySet();
    }
}
