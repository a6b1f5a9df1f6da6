package com.gridintel.ingest.store;

import com.gridintel.ingest.model.Dataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * DDL for the bookkeeping tables and for data partitions.
 *
 * Everything is CREATE ... IF NOT EXISTS so it can run on every start and on every
 * first write to a partition. Column types are kept to ones PostgreSQL and H2 share.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StoreSchema {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring ingestion schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ingest_partitions
            (
                partition_name  VARCHAR(63) NOT NULL PRIMARY KEY,
                base_table      VARCHAR(30) NOT NULL,
                kind            VARCHAR(10) NOT NULL,
                grouping_key    VARCHAR(16) NOT NULL,
                period_start    DATE        NOT NULL,
                created_at      TIMESTAMP   NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ingest_runs
            (
                run_id          VARCHAR(36)   NOT NULL PRIMARY KEY,
                dataset_id      VARCHAR(64)   NOT NULL,
                range_start     TIMESTAMP,
                range_end       TIMESTAMP,
                started_at      TIMESTAMP     NOT NULL,
                completed_at    TIMESTAMP,
                status          VARCHAR(16)   NOT NULL,
                chunks_ok       INTEGER       NOT NULL,
                chunks_failed   INTEGER       NOT NULL,
                records_written BIGINT        NOT NULL,
                error_message   VARCHAR(2000)
            )
        """);

        log.info("Ingestion schema ready.");
    }

    void createRawPartition(Dataset dataset, PartitionKey key) {
        String valueColumns = dataset.getValueFields().stream()
                .map(field -> "    " + field + " DOUBLE PRECISION,\n")
                .collect(Collectors.joining());

        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + key.tableName() + "\n(\n"
                + "    ts           TIMESTAMP   NOT NULL,\n"
                + "    grouping_key VARCHAR(16) NOT NULL,\n"
                + valueColumns
                + "    ingested_at  TIMESTAMP   NOT NULL,\n"
                + "    PRIMARY KEY (ts, grouping_key)\n"
                + ")");
    }

    void createAggregatePartition(PartitionKey key) {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + key.tableName() + """

            (
                trade_date     DATE        NOT NULL,
                interval_label VARCHAR(11) NOT NULL,
                grouping_key   VARCHAR(16) NOT NULL,
                interval_start TIMESTAMP   NOT NULL,
                sample_count   INTEGER     NOT NULL,
                mean_value     DOUBLE PRECISION,
                median_value   DOUBLE PRECISION,
                last_observed  DOUBLE PRECISION,
                computed_at    TIMESTAMP   NOT NULL,
                PRIMARY KEY (trade_date, interval_label, grouping_key)
            )
            """);
    }
}
