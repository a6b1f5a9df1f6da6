package com.gridintel.ingest.exception;

/**
 * A second run was requested for a dataset that is already being ingested in this process.
 */
public class RunInProgressException extends IngestException {

    public RunInProgressException(String message) {
        super(message);
    }
}
