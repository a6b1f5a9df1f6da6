package com.gridintel.ingest.fetch;

import java.util.Map;

/**
 * One upstream row before parsing: column name to raw text, as delivered.
 *
 * @param ordinal position of the row in the upstream payload, for log messages
 */
public record RawFields(int ordinal, Map<String, String> fields) {

    public String field(String name) {
        return fields.get(name);
    }

    @Override
    public String toString() {
        return "row " + ordinal + " " + fields;
    }
}
