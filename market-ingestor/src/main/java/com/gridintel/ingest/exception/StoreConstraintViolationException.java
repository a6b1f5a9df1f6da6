package com.gridintel.ingest.exception;

/**
 * A uniqueness or integrity constraint fired during an upsert. Upserts should make this
 * impossible, so it points at a data-model bug and is surfaced rather than retried.
 */
public class StoreConstraintViolationException extends IngestException {

    public StoreConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
