package com.gridintel.ingest.exception;

/**
 * Run-level failure. Anything of this type stops the current run; per-chunk upstream
 * problems are reported through {@link FetchException} instead.
 */
public class IngestException extends RuntimeException {

    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
