package com.gridintel.ingest.exception;

/**
 * One upstream row could not be turned into a record. The row is dropped; the rest of
 * the chunk is still written.
 */
public class RecordParseException extends Exception {

    public RecordParseException(String message) {
        super(message);
    }

    public RecordParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
