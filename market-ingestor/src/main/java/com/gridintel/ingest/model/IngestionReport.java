package com.gridintel.ingest.model;

import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of one pipeline run for one dataset. Filled in chunk by chunk.
 */
@Getter
public class IngestionReport {

    public enum Status {
        /** Nothing to fetch: the dataset is already up to date. */
        NO_OP,
        SUCCESS,
        /** Some chunks committed, some failed, or committed dates were left unaggregated. */
        PARTIAL,
        /** Every attempted chunk failed. */
        FAILED,
        CANCELLED,
        /** A run-level error stopped the run. */
        ABORTED
    }

    private final String datasetId;
    /** Null when the run aborted before its range was resolved. */
    private final TimeRange range;
    private final boolean dryRun;

    private int chunksOk;
    private final List<ChunkFailure> chunksFailed = new ArrayList<>();
    private long recordsWritten;
    private long recordsRejected;
    private long aggregateIntervalsWritten;
    private final Set<LocalDate> aggregationFailures = new TreeSet<>();
    private boolean cancelled;
    private String abortReason;

    public IngestionReport(String datasetId, TimeRange range, boolean dryRun) {
        this.datasetId = datasetId;
        this.range = range;
        this.dryRun = dryRun;
    }

    public static IngestionReport noOp(String datasetId, TimeRange range, boolean dryRun) {
        return new IngestionReport(datasetId, range, dryRun);
    }

    public void chunkSucceeded(long written, long rejected) {
        chunksOk++;
        recordsWritten += written;
        recordsRejected += rejected;
    }

    public void chunkFailed(ChunkFailure failure) {
        chunksFailed.add(failure);
    }

    /** Trade dates whose raw rows committed but whose aggregates could not be rewritten. */
    public void aggregationFailed(Collection<LocalDate> tradeDates) {
        aggregationFailures.addAll(tradeDates);
    }

    public void addAggregateIntervals(long intervals) {
        aggregateIntervalsWritten += intervals;
    }

    public void markCancelled() {
        cancelled = true;
    }

    public void markAborted(String reason) {
        abortReason = reason;
    }

    public List<ChunkFailure> getChunksFailed() {
        return Collections.unmodifiableList(chunksFailed);
    }

    public Set<LocalDate> getAggregationFailures() {
        return Collections.unmodifiableSet(aggregationFailures);
    }

    public boolean needsAttention() {
        return !chunksFailed.isEmpty() || !aggregationFailures.isEmpty() || abortReason != null;
    }

    public int chunksAttempted() {
        return chunksOk + chunksFailed.size();
    }

    public boolean isNoOp() {
        return chunksAttempted() == 0 && !cancelled && abortReason == null;
    }

    public Status getStatus() {
        if (abortReason != null) return Status.ABORTED;
        if (cancelled) return Status.CANCELLED;
        if (chunksAttempted() == 0) return Status.NO_OP;
        if (chunksFailed.isEmpty()) return aggregationFailures.isEmpty() ? Status.SUCCESS : Status.PARTIAL;
        return chunksOk > 0 ? Status.PARTIAL : Status.FAILED;
    }

    public String summary() {
        String summary = String.format("%s %s %s: %d chunk(s) ok, %d failed, %d record(s) %s, %d rejected, %d aggregate interval(s)",
                datasetId, range != null ? range : "(range unresolved)", getStatus(), chunksOk, chunksFailed.size(),
                recordsWritten, dryRun ? "counted (dry run)" : "written", recordsRejected, aggregateIntervalsWritten);
        if (!aggregationFailures.isEmpty()) {
            summary += ", aggregation failed for " + aggregationFailures;
        }
        return summary;
    }
}
