package com.gridintel.ingest.exception;

public class StoreConnectionException extends IngestException {

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
