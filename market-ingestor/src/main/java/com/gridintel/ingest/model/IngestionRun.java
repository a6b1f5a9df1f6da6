package com.gridintel.ingest.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Journal entry for one non-dry pipeline run.
 * Stored in the ingest_runs table for observability only; never read back as a cursor.
 */
@Data
@Builder
public class IngestionRun {

    private String runId;           // UUID
    private String datasetId;
    private LocalDateTime rangeStart;
    private LocalDateTime rangeEnd;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // IngestionReport.Status name
    private int chunksOk;
    private int chunksFailed;
    private long recordsWritten;
    private String errorMessage;    // abort reason, or the dates left unaggregated
}
