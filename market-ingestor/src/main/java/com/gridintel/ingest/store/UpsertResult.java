package com.gridintel.ingest.store;

public record UpsertResult(int inserted, int updated) {

    public static final UpsertResult EMPTY = new UpsertResult(0, 0);

    public int written() {
        return inserted + updated;
    }

    public UpsertResult plus(UpsertResult other) {
        return new UpsertResult(inserted + other.inserted, updated + other.updated);
    }
}
