package com.gridintel.ingest.store;

import com.gridintel.ingest.config.IngestorProperties;
import com.gridintel.ingest.model.AggregateRecord;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.RawRecord;
import com.gridintel.ingest.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Raw and aggregate storage, physically split into one table per partition key.
 *
 * Writes are upserts on the natural key: an existing row has every value field
 * overwritten and its ingested_at refreshed, a missing row is inserted. A batch is
 * applied in a single transaction, so a chunk is either fully visible or not at all.
 *
 * Partitions are created on first write. The DDL runs before the batch transaction
 * opens, since some engines commit implicitly on DDL; creating a table that a
 * rolled-back batch then leaves empty is harmless.
 */
@Repository
@Slf4j
public class PartitionedStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final PartitionRouter router;
    private final StoreSchema schema;
    private final Clock clock;

    /** Partition tables created or confirmed by this process. */
    private final Set<String> knownPartitions = ConcurrentHashMap.newKeySet();

    public PartitionedStore(JdbcTemplate jdbcTemplate,
                            PlatformTransactionManager transactionManager,
                            PartitionRouter router,
                            StoreSchema schema,
                            Clock clock,
                            IngestorProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.router = router;
        this.schema = schema;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(
                (int) Math.max(1, properties.getPipeline().getWriteTimeout().toSeconds()));
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    /**
     * Upserts a batch of raw records atomically.
     *
     * @return inserted/updated counts after collapsing duplicate natural keys
     * @throws com.gridintel.ingest.exception.PartitionRoutingException before anything is written
     */
    public UpsertResult upsert(Dataset dataset, List<RawRecord> records) {
        if (records.isEmpty()) return UpsertResult.EMPTY;

        List<RawRecord> unique = collapseDuplicates(dataset, records);
        Map<PartitionKey, List<RawRecord>> routed = router.routeAll(dataset, unique);

        try {
            routed.keySet().forEach(key -> ensurePartition(dataset, key));
            LocalDateTime ingestedAt = LocalDateTime.now(clock);

            UpsertResult result = transactionTemplate.execute(status -> {
                UpsertResult total = UpsertResult.EMPTY;
                for (Map.Entry<PartitionKey, List<RawRecord>> entry : routed.entrySet()) {
                    total = total.plus(upsertRaw(dataset, entry.getKey(), entry.getValue(), ingestedAt));
                }
                return total;
            });

            log.debug("{}: upserted {} raw record(s) into {} partition(s): {} inserted, {} updated",
                    dataset.getId(), unique.size(), routed.size(), result.inserted(), result.updated());
            return result;
        } catch (DataAccessException | TransactionException e) {
            throw StoreExceptions.translate("Raw upsert for " + dataset.getId(), e);
        }
    }

    /**
     * Upserts aggregate rows atomically. Same semantics as {@link #upsert}, keyed on
     * (trade_date, interval_label, grouping_key).
     */
    public UpsertResult upsertAggregates(Dataset dataset, List<AggregateRecord> aggregates) {
        if (aggregates.isEmpty()) return UpsertResult.EMPTY;

        Map<PartitionKey, List<AggregateRecord>> routed = new LinkedHashMap<>();
        for (AggregateRecord aggregate : aggregates) {
            PartitionKey key = router.route(dataset, PartitionKey.Kind.AGGREGATE,
                    aggregate.getGroupingKey(), aggregate.getTradeDate());
            routed.computeIfAbsent(key, k -> new ArrayList<>()).add(aggregate);
        }

        try {
            routed.keySet().forEach(key -> ensurePartition(dataset, key));
            LocalDateTime computedAt = LocalDateTime.now(clock);

            return transactionTemplate.execute(status -> {
                UpsertResult total = UpsertResult.EMPTY;
                for (Map.Entry<PartitionKey, List<AggregateRecord>> entry : routed.entrySet()) {
                    total = total.plus(upsertAggregateBatch(entry.getKey(), entry.getValue(), computedAt));
                }
                return total;
            });
        } catch (DataAccessException | TransactionException e) {
            throw StoreExceptions.translate("Aggregate upsert for " + dataset.getId(), e);
        }
    }

    private UpsertResult upsertRaw(Dataset dataset, PartitionKey key, List<RawRecord> batch, LocalDateTime ingestedAt) {
        List<String> fields = dataset.getValueFields();
        String table = key.tableName();

        String update = "UPDATE " + table + " SET "
                + fields.stream().map(f -> f + " = ?").collect(Collectors.joining(", "))
                + ", ingested_at = ? WHERE ts = ? AND grouping_key = ?";

        int[] counts = jdbcTemplate.batchUpdate(update, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                RawRecord record = batch.get(i);
                int idx = bindValues(ps, 1, fields, record);
                ps.setObject(idx++, ingestedAt);
                ps.setObject(idx++, record.getTimestamp());
                ps.setString(idx, record.getGroupingKey());
            }

            @Override
            public int getBatchSize() {
                return batch.size();
            }
        });

        List<RawRecord> missing = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == 0) missing.add(batch.get(i));
        }

        if (!missing.isEmpty()) {
            String insert = "INSERT INTO " + table + " (ts, grouping_key, "
                    + String.join(", ", fields) + ", ingested_at) VALUES ("
                    + placeholders(fields.size() + 3) + ")";

            jdbcTemplate.batchUpdate(insert, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    RawRecord record = missing.get(i);
                    ps.setObject(1, record.getTimestamp());
                    ps.setString(2, record.getGroupingKey());
                    int idx = bindValues(ps, 3, fields, record);
                    ps.setObject(idx, ingestedAt);
                }

                @Override
                public int getBatchSize() {
                    return missing.size();
                }
            });
        }

        return new UpsertResult(missing.size(), batch.size() - missing.size());
    }

    private UpsertResult upsertAggregateBatch(PartitionKey key, List<AggregateRecord> batch, LocalDateTime computedAt) {
        String table = key.tableName();

        int[] counts = jdbcTemplate.batchUpdate("UPDATE " + table + """
                 SET interval_start = ?, sample_count = ?, mean_value = ?, median_value = ?,
                     last_observed = ?, computed_at = ?
                 WHERE trade_date = ? AND interval_label = ? AND grouping_key = ?
                """, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                AggregateRecord a = batch.get(i);
                ps.setObject(1, a.getIntervalStart());
                ps.setInt(2, a.getSampleCount());
                setDouble(ps, 3, a.getMean());
                setDouble(ps, 4, a.getMedian());
                setDouble(ps, 5, a.getLastObserved());
                ps.setObject(6, computedAt);
                ps.setObject(7, a.getTradeDate());
                ps.setString(8, a.getIntervalLabel());
                ps.setString(9, a.getGroupingKey());
            }

            @Override
            public int getBatchSize() {
                return batch.size();
            }
        });

        List<AggregateRecord> missing = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == 0) missing.add(batch.get(i));
        }

        if (!missing.isEmpty()) {
            jdbcTemplate.batchUpdate("INSERT INTO " + table + """
                     (trade_date, interval_label, grouping_key, interval_start, sample_count,
                      mean_value, median_value, last_observed, computed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    AggregateRecord a = missing.get(i);
                    ps.setObject(1, a.getTradeDate());
                    ps.setString(2, a.getIntervalLabel());
                    ps.setString(3, a.getGroupingKey());
                    ps.setObject(4, a.getIntervalStart());
                    ps.setInt(5, a.getSampleCount());
                    setDouble(ps, 6, a.getMean());
                    setDouble(ps, 7, a.getMedian());
                    setDouble(ps, 8, a.getLastObserved());
                    ps.setObject(9, computedAt);
                }

                @Override
                public int getBatchSize() {
                    return missing.size();
                }
            });
        }

        return new UpsertResult(missing.size(), batch.size() - missing.size());
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    /** Backfill cursor: latest persisted timestamp of the dataset, empty for an empty store. */
    public Optional<LocalDateTime> maxTimestamp(Dataset dataset) {
        return boundaryTimestamp(dataset, "MAX", true);
    }

    public Optional<LocalDateTime> minTimestamp(Dataset dataset) {
        return boundaryTimestamp(dataset, "MIN", false);
    }

    private Optional<LocalDateTime> boundaryTimestamp(Dataset dataset, String function, boolean newestFirst) {
        try {
            for (String partition : registeredPartitions(dataset, PartitionKey.Kind.RAW, newestFirst)) {
                LocalDateTime boundary = jdbcTemplate.queryForObject(
                        "SELECT " + function + "(ts) FROM " + partition + " WHERE grouping_key = ?",
                        LocalDateTime.class, dataset.getGroupingKey());
                if (boundary != null) return Optional.of(boundary);
            }
            return Optional.empty();
        } catch (DataAccessException e) {
            throw StoreExceptions.translate(function + "(ts) for " + dataset.getId(), e);
        }
    }

    /** Raw records of the dataset's grouping key in {@code range}, ascending by timestamp. */
    public List<RawRecord> readRaw(Dataset dataset, TimeRange range) {
        List<String> fields = dataset.getValueFields();
        RowMapper<RawRecord> mapper = (rs, n) -> {
            Map<String, Double> values = new LinkedHashMap<>();
            for (String field : fields) {
                values.put(field, getDouble(rs, field));
            }
            return RawRecord.builder()
                    .timestamp(rs.getObject("ts", LocalDateTime.class))
                    .groupingKey(rs.getString("grouping_key"))
                    .values(values)
                    .build();
        };

        try {
            Set<String> existing = new LinkedHashSet<>(registeredPartitions(dataset, PartitionKey.Kind.RAW, false));
            List<RawRecord> result = new ArrayList<>();
            for (PartitionKey key : router.partitionsCovering(dataset, PartitionKey.Kind.RAW, range)) {
                if (!existing.contains(key.tableName())) continue;
                result.addAll(jdbcTemplate.query(
                        "SELECT ts, grouping_key, " + String.join(", ", fields) + " FROM " + key.tableName()
                                + " WHERE grouping_key = ? AND ts >= ? AND ts < ? ORDER BY ts",
                        mapper, dataset.getGroupingKey(), range.start(), range.end()));
            }
            return result;
        } catch (DataAccessException e) {
            throw StoreExceptions.translate("Raw read for " + dataset.getId(), e);
        }
    }

    /** Aggregate rows for trade dates {@code from..to} inclusive, ordered by date and interval. */
    public List<AggregateRecord> readAggregates(Dataset dataset, LocalDate from, LocalDate to) {
        RowMapper<AggregateRecord> mapper = (rs, n) -> AggregateRecord.builder()
                .tradeDate(rs.getObject("trade_date", LocalDate.class))
                .intervalLabel(rs.getString("interval_label"))
                .groupingKey(rs.getString("grouping_key"))
                .intervalStart(rs.getObject("interval_start", LocalDateTime.class))
                .sampleCount(rs.getInt("sample_count"))
                .mean(getDouble(rs, "mean_value"))
                .median(getDouble(rs, "median_value"))
                .lastObserved(getDouble(rs, "last_observed"))
                .build();

        try {
            Set<String> existing = new LinkedHashSet<>(registeredPartitions(dataset, PartitionKey.Kind.AGGREGATE, false));
            List<AggregateRecord> result = new ArrayList<>();
            for (PartitionKey key : router.partitionsCovering(dataset, PartitionKey.Kind.AGGREGATE, from, to)) {
                if (!existing.contains(key.tableName())) continue;
                result.addAll(jdbcTemplate.query(
                        "SELECT trade_date, interval_label, grouping_key, interval_start, sample_count,"
                                + " mean_value, median_value, last_observed FROM " + key.tableName()
                                + " WHERE grouping_key = ? AND trade_date >= ? AND trade_date <= ?"
                                + " ORDER BY trade_date, interval_start",
                        mapper, dataset.getGroupingKey(), from, to));
            }
            return result;
        } catch (DataAccessException e) {
            throw StoreExceptions.translate("Aggregate read for " + dataset.getId(), e);
        }
    }

    /** Names of the dataset's partitions of one kind, ordered by period. */
    public List<String> registeredPartitions(Dataset dataset, PartitionKey.Kind kind, boolean newestFirst) {
        return jdbcTemplate.queryForList(
                "SELECT partition_name FROM ingest_partitions"
                        + " WHERE base_table = ? AND kind = ? AND grouping_key = ?"
                        + " ORDER BY period_start " + (newestFirst ? "DESC" : "ASC"),
                String.class, dataset.getTable(), kind.name(), dataset.getGroupingKey());
    }

    // ── Partition management ─────────────────────────────────────────────────

    /** Create-if-absent for the partition table and its registry row. Idempotent. */
    void ensurePartition(Dataset dataset, PartitionKey key) {
        String name = key.tableName();
        if (knownPartitions.contains(name)) return;

        if (key.kind() == PartitionKey.Kind.RAW) {
            schema.createRawPartition(dataset, key);
        } else {
            schema.createAggregatePartition(key);
        }

        Integer registered = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM ingest_partitions WHERE partition_name = ?", Integer.class, name);
        if (registered == null || registered == 0) {
            try {
                jdbcTemplate.update("""
                        INSERT INTO ingest_partitions
                            (partition_name, base_table, kind, grouping_key, period_start, created_at)
                        VALUES (?, ?, ?, ?, ?, ?)
                        """,
                        name, key.baseTable(), key.kind().name(), key.groupingKey(), key.periodStart(),
                        LocalDateTime.now(clock));
                log.info("Created partition {} for dataset {}", name, dataset.getId());
            } catch (DuplicateKeyException e) {
                log.debug("Partition {} registered concurrently", name);
            }
        }
        knownPartitions.add(name);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private List<RawRecord> collapseDuplicates(Dataset dataset, List<RawRecord> records) {
        // Later rows win: upstreams append corrections after the original value
        Map<String, RawRecord> byKey = new LinkedHashMap<>();
        for (RawRecord record : records) {
            byKey.put(record.getTimestamp() + "|" + record.getGroupingKey(), record);
        }
        if (byKey.size() < records.size()) {
            log.warn("{}: {} duplicate natural key(s) in batch, keeping last occurrence",
                    dataset.getId(), records.size() - byKey.size());
            return new ArrayList<>(byKey.values());
        }
        return records;
    }

    private static int bindValues(PreparedStatement ps, int start, List<String> fields, RawRecord record)
            throws SQLException {
        int idx = start;
        for (String field : fields) {
            setDouble(ps, idx++, record.value(field));
        }
        return idx;
    }

    private static void setDouble(PreparedStatement ps, int idx, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.DOUBLE);
        } else {
            ps.setDouble(idx, value);
        }
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
