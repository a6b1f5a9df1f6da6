package com.gridintel.ingest.exception;

/**
 * The upstream does not have the resource for the requested range at all.
 */
public class PermanentFetchException extends FetchException {

    public PermanentFetchException(String message) {
        super(message);
    }

    public PermanentFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
