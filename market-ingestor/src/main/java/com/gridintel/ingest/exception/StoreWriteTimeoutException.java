package com.gridintel.ingest.exception;

/**
 * A chunk write exceeded its time budget and was rolled back. The pipeline records the
 * chunk as failed and carries on.
 */
public class StoreWriteTimeoutException extends IngestException {

    public StoreWriteTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
