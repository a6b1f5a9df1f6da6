package com.gridintel.ingest.exception;

/**
 * Upstream fetch failure for a single chunk.
 */
public abstract class FetchException extends Exception {

    protected FetchException(String message) {
        super(message);
    }

    protected FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    /** True when a later attempt may succeed (network, throttling, 5xx). */
    public abstract boolean isTransient();
}
