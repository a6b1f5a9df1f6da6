package com.gridintel.ingest.model;

/**
 * A chunk that was not committed, with the reason. Listed in the run report so an
 * operator (or the auditor) can target exactly that range for a re-run.
 */
public record ChunkFailure(TimeRange range, Kind kind, String message) {

    public enum Kind {
        /** Upstream unavailable; picked up again by the next scheduled run. */
        TRANSIENT,
        /** Upstream has no such resource for the range; needs operator review. */
        PERMANENT,
        /** Fetch or write exceeded its time budget. */
        TIMEOUT
    }
}
