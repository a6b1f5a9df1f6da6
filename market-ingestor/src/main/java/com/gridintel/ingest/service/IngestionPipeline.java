package com.gridintel.ingest.service;

import com.gridintel.ingest.config.IngestorProperties;
import com.gridintel.ingest.exception.FetchException;
import com.gridintel.ingest.exception.IngestException;
import com.gridintel.ingest.exception.RecordParseException;
import com.gridintel.ingest.exception.RunInProgressException;
import com.gridintel.ingest.exception.StoreConnectionException;
import com.gridintel.ingest.exception.StoreWriteTimeoutException;
import com.gridintel.ingest.exception.TransientFetchException;
import com.gridintel.ingest.fetch.FetchAdapter;
import com.gridintel.ingest.fetch.FetchAdapterRegistry;
import com.gridintel.ingest.fetch.RawFields;
import com.gridintel.ingest.fetch.RecordParser;
import com.gridintel.ingest.model.BackfillResolution;
import com.gridintel.ingest.model.ChunkFailure;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.IngestionReport;
import com.gridintel.ingest.model.IngestionRun;
import com.gridintel.ingest.model.RawRecord;
import com.gridintel.ingest.model.TimeRange;
import com.gridintel.ingest.store.IngestRunRepository;
import com.gridintel.ingest.store.PartitionedStore;
import com.gridintel.ingest.store.UpsertResult;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates one ingestion run for one dataset.
 *
 * The run resolves its range (or takes an explicit one), splits it into chunks and
 * processes them strictly in ascending order: fetch, parse, upsert in one transaction,
 * then re-aggregate the trade dates the chunk touched. A chunk whose fetch fails is
 * recorded and skipped; the run carries on with the next one. Only run-level errors
 * (unknown dataset, routing errors, store unreachable) abort the run.
 *
 * Cancellation is honoured between chunks, never inside a chunk's write.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionPipeline {

    private final DatasetRegistry datasets;
    private final FetchAdapterRegistry adapters;
    private final BackfillResolver resolver;
    private final ChunkPlanner planner;
    private final PartitionedStore store;
    private final IntervalAggregator aggregator;
    private final IngestRunRepository runs;
    private final IngestorProperties properties;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();
    private final Map<String, IngestionReport> running = new ConcurrentHashMap<>();
    private final Set<String> active = ConcurrentHashMap.newKeySet();

    private final AtomicInteger fetchThreads = new AtomicInteger();
    private final ExecutorService fetchExecutor = Executors.newCachedThreadPool(task -> {
        Thread thread = new Thread(task, "ingest-fetch-" + fetchThreads.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    /** Auto mode: fetch whatever the backfill resolver says is missing. */
    public IngestionReport run(String datasetId) {
        return run(datasetId, null, false);
    }

    /**
     * @param rangeOverride explicit range to (re)ingest, or null for auto mode
     * @param dryRun        fetch and parse as usual but only count, never write
     * @throws com.gridintel.ingest.exception.InvalidDatasetException for an unknown dataset or source
     * @throws RunInProgressException if the dataset is already being ingested
     * @throws IngestException when a run-level error aborted the run
     */
    public IngestionReport run(String datasetId, TimeRange rangeOverride, boolean dryRun) {
        Dataset dataset = datasets.get(datasetId);
        FetchAdapter adapter = adapters.get(dataset.getSource());

        ReentrantLock lock = locks.computeIfAbsent(dataset.getId(), id -> new ReentrantLock());
        if (!lock.tryLock()) {
            throw new RunInProgressException("Ingestion of " + dataset.getId() + " is already running");
        }

        AtomicBoolean cancelled = cancelFlags.computeIfAbsent(dataset.getId(), id -> new AtomicBoolean());
        cancelled.set(false);
        active.add(dataset.getId());
        try {
            return execute(dataset, adapter, rangeOverride, dryRun, cancelled);
        } finally {
            active.remove(dataset.getId());
            running.remove(dataset.getId());
            lock.unlock();
        }
    }

    /**
     * Asks a running ingestion of the dataset to stop before its next chunk.
     *
     * @return false when nothing was running
     */
    public boolean cancel(String datasetId) {
        Dataset dataset = datasets.get(datasetId);
        if (!active.contains(dataset.getId())) return false;

        cancelFlags.computeIfAbsent(dataset.getId(), id -> new AtomicBoolean()).set(true);
        log.info("Cancellation requested for {}", dataset.getId());
        return true;
    }

    /** Reports of runs in progress, by dataset id. */
    public Map<String, IngestionReport> inProgress() {
        return new LinkedHashMap<>(running);
    }

    @PreDestroy
    void shutdown() {
        fetchExecutor.shutdownNow();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private IngestionReport execute(Dataset dataset, FetchAdapter adapter, TimeRange rangeOverride,
                                    boolean dryRun, AtomicBoolean cancelled) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        IngestionReport report = null;

        try {
            TimeRange range = rangeOverride;
            if (range == null) {
                BackfillResolution resolution = resolver.resolve(dataset);
                if (resolution.nothingToDo()) {
                    log.info("{} is up to date (cursor {}), nothing to do", dataset.getId(), resolution.cursor());
                    return IngestionReport.noOp(dataset.getId(), resolution.range(), dryRun);
                }
                range = resolution.range();
            }
            if (range.isEmpty()) {
                log.info("{}: empty range {}, nothing to do", dataset.getId(), range);
                return IngestionReport.noOp(dataset.getId(), range, dryRun);
            }

            report = new IngestionReport(dataset.getId(), range, dryRun);
            running.put(dataset.getId(), report);

            log.info("{}{}: ingesting {} in {} chunk(s) of at most {}",
                    dryRun ? "[dry run] " : "", dataset.getId(), range,
                    planner.chunkCount(range, dataset.getMaxChunkSpan()), dataset.getMaxChunkSpan());

            Iterator<TimeRange> chunks = planner.plan(range, dataset.getMaxChunkSpan()).iterator();
            while (chunks.hasNext()) {
                if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                    report.markCancelled();
                    log.warn("{}: run cancelled after {} chunk(s)", dataset.getId(), report.chunksAttempted());
                    break;
                }
                processChunk(dataset, adapter, chunks.next(), report);
            }
        } catch (IngestException e) {
            if (report == null) {
                report = new IngestionReport(dataset.getId(), rangeOverride, dryRun);
            }
            report.markAborted(e.getMessage());
            log.error("{}: run aborted: {}", dataset.getId(), e.getMessage(), e);
            throw e;
        } finally {
            if (report != null) {
                logSummary(report);
                if (!dryRun) journal(report, startedAt);
            }
        }
        return report;
    }

    private void processChunk(Dataset dataset, FetchAdapter adapter, TimeRange chunk, IngestionReport report) {
        log.debug("{}: fetching chunk {}", dataset.getId(), chunk);

        List<RawFields> rows;
        try {
            rows = fetchWithTimeout(dataset, adapter, chunk);
        } catch (FetchException e) {
            ChunkFailure.Kind kind = e.isTransient() ? ChunkFailure.Kind.TRANSIENT : ChunkFailure.Kind.PERMANENT;
            report.chunkFailed(new ChunkFailure(chunk, kind, e.getMessage()));
            log.warn("{}: chunk {} failed ({}): {}", dataset.getId(), chunk, kind, e.getMessage());
            return;
        } catch (TimeoutException e) {
            String message = "Fetch exceeded " + properties.getPipeline().getFetchTimeout();
            report.chunkFailed(new ChunkFailure(chunk, ChunkFailure.Kind.TIMEOUT, message));
            log.warn("{}: chunk {} failed (TIMEOUT): {}", dataset.getId(), chunk, message);
            return;
        }

        ParsedChunk parsed = parse(dataset, adapter.parser(), chunk, rows);

        if (report.isDryRun()) {
            report.chunkSucceeded(parsed.records().size(), parsed.rejected());
            log.info("[dry run] {}: chunk {} would write {} record(s), {} rejected",
                    dataset.getId(), chunk, parsed.records().size(), parsed.rejected());
            return;
        }

        UpsertResult result;
        try {
            result = store.upsert(dataset, parsed.records());
        } catch (StoreWriteTimeoutException e) {
            report.chunkFailed(new ChunkFailure(chunk, ChunkFailure.Kind.TIMEOUT, e.getMessage()));
            log.warn("{}: chunk {} write timed out, rolled back: {}", dataset.getId(), chunk, e.getMessage());
            return;
        } catch (StoreConnectionException e) {
            report.chunkFailed(new ChunkFailure(chunk, ChunkFailure.Kind.TRANSIENT, e.getMessage()));
            throw e;
        }

        report.chunkSucceeded(result.written(), parsed.rejected());
        log.info("{}: chunk {} committed: {} inserted, {} updated, {} rejected",
                dataset.getId(), chunk, result.inserted(), result.updated(), parsed.rejected());

        reaggregate(dataset, parsed.records(), report);
    }

    private List<RawFields> fetchWithTimeout(Dataset dataset, FetchAdapter adapter, TimeRange chunk)
            throws FetchException, TimeoutException {
        Duration timeout = properties.getPipeline().getFetchTimeout();
        Future<List<RawFields>> future = fetchExecutor.submit(() -> adapter.fetch(dataset.getResource(), chunk));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchException) {
                throw (FetchException) cause;
            }
            throw new TransientFetchException("Fetch of " + chunk + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientFetchException("Interrupted while fetching " + chunk, e);
        }
    }

    private ParsedChunk parse(Dataset dataset, RecordParser parser, TimeRange chunk, List<RawFields> rows) {
        int sampleSize = properties.getPipeline().getRejectedSampleSize();
        List<RawRecord> records = new ArrayList<>(rows.size());
        long rejected = 0;

        for (RawFields row : rows) {
            RawRecord record;
            try {
                record = parser.parse(row, dataset);
            } catch (RecordParseException e) {
                if (rejected++ < sampleSize) {
                    log.warn("{}: dropped {}: {}", dataset.getId(), row, e.getMessage());
                }
                continue;
            }
            if (!chunk.contains(record.getTimestamp())) {
                if (rejected++ < sampleSize) {
                    log.warn("{}: dropped record at {} outside chunk {}", dataset.getId(), record.getTimestamp(), chunk);
                }
                continue;
            }
            records.add(record);
        }

        if (rejected > sampleSize) {
            log.warn("{}: {} row(s) rejected in chunk {} ({} logged)", dataset.getId(), rejected, chunk, sampleSize);
        }
        return new ParsedChunk(records, rejected);
    }

    private void reaggregate(Dataset dataset, List<RawRecord> records, IngestionReport report) {
        if (!dataset.isAggregationEnabled() || records.isEmpty()) return;

        Set<LocalDate> touched = new TreeSet<>();
        for (RawRecord record : records) {
            touched.add(record.getTimestamp().toLocalDate());
        }

        try {
            report.addAggregateIntervals(aggregator.aggregate(dataset, touched));
        } catch (StoreWriteTimeoutException e) {
            // Raw rows stay committed and the cursor moves past them, so the dates must be reported
            report.aggregationFailed(touched);
            log.warn("{}: re-aggregation of {} timed out: {}", dataset.getId(), touched, e.getMessage());
        }
    }

    private void logSummary(IngestionReport report) {
        if (!report.needsAttention()) {
            log.info("Run finished: {}", report.summary());
            return;
        }
        log.warn("Run finished: {}", report.summary());
        report.getChunksFailed().forEach(f ->
                log.warn("  failed chunk {} ({}): {}", f.range(), f.kind(), f.message()));
        if (!report.getAggregationFailures().isEmpty()) {
            log.warn("  aggregates not rewritten for {}; rerun aggregation for these dates",
                    report.getAggregationFailures());
        }
    }

    private void journal(IngestionReport report, LocalDateTime startedAt) {
        TimeRange range = report.getRange();
        String error = report.getAbortReason();
        if (error == null && !report.getAggregationFailures().isEmpty()) {
            error = "Aggregation failed for " + report.getAggregationFailures();
        }
        runs.save(IngestionRun.builder()
                .runId(UUID.randomUUID().toString())
                .datasetId(report.getDatasetId())
                .rangeStart(range != null ? range.start() : null)
                .rangeEnd(range != null ? range.end() : null)
                .startedAt(startedAt)
                .completedAt(LocalDateTime.now(clock))
                .status(report.getStatus().name())
                .chunksOk(report.getChunksOk())
                .chunksFailed(report.getChunksFailed().size())
                .recordsWritten(report.getRecordsWritten())
                .errorMessage(error)
                .build());
    }

    private record ParsedChunk(List<RawRecord> records, long rejected) {
    }
}
