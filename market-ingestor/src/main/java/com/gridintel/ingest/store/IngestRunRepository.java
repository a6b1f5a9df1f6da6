package com.gridintel.ingest.store;

import com.gridintel.ingest.model.IngestionRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Run journal in ingest_runs. Observability only: the backfill cursor comes from
 * the data itself, so losing a journal row never changes what gets ingested.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class IngestRunRepository {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<IngestionRun> ROW_MAPPER = (rs, n) -> IngestionRun.builder()
            .runId(rs.getString("run_id"))
            .datasetId(rs.getString("dataset_id"))
            .rangeStart(rs.getObject("range_start", LocalDateTime.class))
            .rangeEnd(rs.getObject("range_end", LocalDateTime.class))
            .startedAt(rs.getObject("started_at", LocalDateTime.class))
            .completedAt(rs.getObject("completed_at", LocalDateTime.class))
            .status(rs.getString("status"))
            .chunksOk(rs.getInt("chunks_ok"))
            .chunksFailed(rs.getInt("chunks_failed"))
            .recordsWritten(rs.getLong("records_written"))
            .errorMessage(rs.getString("error_message"))
            .build();

    /** Writes a journal row. Failures are logged and swallowed so they never fail a run. */
    public void save(IngestionRun run) {
        try {
            jdbcTemplate.update("""
                INSERT INTO ingest_runs
                (run_id, dataset_id, range_start, range_end, started_at, completed_at,
                 status, chunks_ok, chunks_failed, records_written, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    new Object[]{
                            run.getRunId(),
                            run.getDatasetId(),
                            toTimestamp(run.getRangeStart()),
                            toTimestamp(run.getRangeEnd()),
                            toTimestamp(run.getStartedAt()),
                            toTimestamp(run.getCompletedAt()),
                            run.getStatus(),
                            run.getChunksOk(),
                            run.getChunksFailed(),
                            run.getRecordsWritten(),
                            truncate(run.getErrorMessage())
                    },
                    new int[]{
                            Types.VARCHAR, Types.VARCHAR, Types.TIMESTAMP, Types.TIMESTAMP, Types.TIMESTAMP,
                            Types.TIMESTAMP, Types.VARCHAR, Types.INTEGER, Types.INTEGER, Types.BIGINT,
                            Types.VARCHAR
                    });
        } catch (DataAccessException e) {
            log.warn("Failed to write ingestion run {} for {}: {}", run.getRunId(), run.getDatasetId(), e.getMessage());
        }
    }

    /** Most recent runs of a dataset, newest first. */
    public List<IngestionRun> recent(String datasetId, int limit) {
        return jdbcTemplate.query("""
                SELECT run_id, dataset_id, range_start, range_end, started_at, completed_at,
                       status, chunks_ok, chunks_failed, records_written, error_message
                FROM ingest_runs
                WHERE dataset_id = ?
                ORDER BY started_at DESC
                LIMIT ?
                """, ROW_MAPPER, datasetId, limit);
    }

    private static Timestamp toTimestamp(LocalDateTime value) {
        return value == null ? null : Timestamp.valueOf(value);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) return message;
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
