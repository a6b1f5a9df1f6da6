package com.gridintel.ingest.config;

import com.gridintel.ingest.exception.IngestException;
import com.gridintel.ingest.exception.InvalidDatasetException;
import com.gridintel.ingest.exception.RunInProgressException;
import com.gridintel.ingest.model.AuditReport;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.IngestionReport;
import com.gridintel.ingest.model.IngestionRun;
import com.gridintel.ingest.model.TimeRange;
import com.gridintel.ingest.service.ConsistencyAuditor;
import com.gridintel.ingest.service.DatasetRegistry;
import com.gridintel.ingest.service.IngestionPipeline;
import com.gridintel.ingest.service.IntervalAggregator;
import com.gridintel.ingest.store.IngestRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Manual triggers and read-only views. Ingestion runs synchronously on the request
 * thread and returns its report; dates are civil days, {@code end} inclusive.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class IngestController {

    private final IngestionPipeline pipeline;
    private final IntervalAggregator aggregator;
    private final ConsistencyAuditor auditor;
    private final DatasetRegistry datasets;
    private final IngestRunRepository runs;

    // ── Triggers ──────────────────────────────────────────────────────────────

    /**
     * POST /ingest/ceps-imbalance                       auto mode
     * POST /ingest/ceps-imbalance?start=2025-11-01&end=2025-11-03&dryRun=true
     */
    @PostMapping("/ingest/{dataset}")
    public ResponseEntity<Map<String, Object>> ingest(
            @PathVariable("dataset") String datasetId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(defaultValue = "false") boolean dryRun) {
        TimeRange range = null;
        if (start != null || end != null) {
            if (start == null) {
                throw new IllegalArgumentException("start is required when end is given");
            }
            LocalDate last = end != null ? end : start;
            if (last.isBefore(start)) {
                throw new IllegalArgumentException("end must not be before start");
            }
            range = TimeRange.ofDays(start, last);
        }
        return ResponseEntity.ok(toBody(pipeline.run(datasetId, range, dryRun)));
    }

    @PostMapping("/ingest/{dataset}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable("dataset") String datasetId) {
        boolean requested = pipeline.cancel(datasetId);
        return ResponseEntity.accepted().body(Map.of(
                "dataset", datasetId,
                "status", requested ? "cancelling" : "not-running"));
    }

    @PostMapping("/aggregate/{dataset}")
    public ResponseEntity<Map<String, Object>> aggregate(
            @PathVariable("dataset") String datasetId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        Dataset dataset = datasets.get(datasetId);
        LocalDate last = end != null ? end : start;
        if (last.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
        long intervals = aggregator.aggregateRange(dataset, start, last);
        return ResponseEntity.ok(Map.of(
                "dataset", dataset.getId(),
                "start", start.toString(),
                "end", last.toString(),
                "intervalsWritten", intervals));
    }

    // ── Views ─────────────────────────────────────────────────────────────────

    @GetMapping("/audit/{dataset}")
    public ResponseEntity<AuditReport> audit(
            @PathVariable("dataset") String datasetId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        Dataset dataset = datasets.get(datasetId);
        return ResponseEntity.ok(auditor.audit(dataset, start, end != null ? end : start));
    }

    @GetMapping("/ingest/{dataset}/runs")
    public ResponseEntity<List<IngestionRun>> recentRuns(
            @PathVariable("dataset") String datasetId,
            @RequestParam(defaultValue = "20") int limit) {
        Dataset dataset = datasets.get(datasetId);
        return ResponseEntity.ok(runs.recent(dataset.getId(), Math.max(1, Math.min(limit, 500))));
    }

    @GetMapping("/ingest/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> inProgress = new LinkedHashMap<>();
        pipeline.inProgress().forEach((id, report) -> inProgress.put(id, toBody(report)));

        return ResponseEntity.ok(Map.of(
                "service", "gridintel-market-ingestor",
                "version", "1.0.0",
                "datasets", datasets.ids(),
                "running", inProgress));
    }

    // ── Error mapping ─────────────────────────────────────────────────────────

    @ExceptionHandler(InvalidDatasetException.class)
    public ResponseEntity<Map<String, String>> notFound(InvalidDatasetException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(RunInProgressException.class)
    public ResponseEntity<Map<String, String>> conflict(RunInProgressException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IngestException.class)
    public ResponseEntity<Map<String, String>> runFailed(IngestException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
    }

    private static Map<String, Object> toBody(IngestionReport report) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dataset", report.getDatasetId());
        body.put("range", String.valueOf(report.getRange()));
        body.put("status", report.getStatus().name());
        body.put("dryRun", report.isDryRun());
        body.put("chunksOk", report.getChunksOk());
        body.put("chunksFailed", report.getChunksFailed().stream()
                .map(f -> Map.of(
                        "start", f.range().start().toString(),
                        "end", f.range().end().toString(),
                        "kind", f.kind().name(),
                        "message", String.valueOf(f.message())))
                .collect(Collectors.toList()));
        body.put("recordsWritten", report.getRecordsWritten());
        body.put("recordsRejected", report.getRecordsRejected());
        body.put("aggregateIntervalsWritten", report.getAggregateIntervalsWritten());
        body.put("aggregationFailedDates", report.getAggregationFailures().stream()
                .map(LocalDate::toString)
                .collect(Collectors.toList()));
        return body;
    }
}
