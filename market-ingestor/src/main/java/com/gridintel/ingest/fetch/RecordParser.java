package com.gridintel.ingest.fetch;

import com.gridintel.ingest.exception.RecordParseException;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.RawRecord;

/**
 * Turns one upstream row into a record of the dataset. Timestamps come out as naive
 * local time in the dataset's zone.
 */
@FunctionalInterface
public interface RecordParser {

    RawRecord parse(RawFields row, Dataset dataset) throws RecordParseException;
}
