package com.gridintel.ingest.exception;

/**
 * A record's grouping key is outside the declared partition domain of its table.
 * Never retried.
 */
public class PartitionRoutingException extends IngestException {

    public PartitionRoutingException(String message) {
        super(message);
    }
}
