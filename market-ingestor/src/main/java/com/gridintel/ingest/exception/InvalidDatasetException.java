package com.gridintel.ingest.exception;

/**
 * Unknown dataset id or a dataset whose configuration cannot be used.
 */
public class InvalidDatasetException extends IngestException {

    public InvalidDatasetException(String message) {
        super(message);
    }
}
