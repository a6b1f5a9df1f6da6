package com.gridintel.ingest.fetch;

import com.gridintel.ingest.exception.FetchException;
import com.gridintel.ingest.model.TimeRange;

import java.util.List;

/**
 * Access to one upstream source. Implementations are registered by {@link #source()}
 * in the {@link FetchAdapterRegistry}.
 */
public interface FetchAdapter {

    /** Name datasets use to refer to this source. */
    String source();

    /**
     * Fetches every row the upstream has for {@code resource} in {@code range}.
     * Returns an empty list when there is simply no data yet.
     *
     * @throws com.gridintel.ingest.exception.TransientFetchException when a retry may succeed
     * @throws com.gridintel.ingest.exception.PermanentFetchException when it will not
     */
    List<RawFields> fetch(String resource, TimeRange range) throws FetchException;

    RecordParser parser();
}
