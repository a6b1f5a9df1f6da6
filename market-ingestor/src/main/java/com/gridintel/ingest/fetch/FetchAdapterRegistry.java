package com.gridintel.ingest.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridintel.ingest.config.IngestorProperties;
import com.gridintel.ingest.exception.InvalidDatasetException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source name to adapter. Holds every {@link FetchAdapter} bean in the context plus
 * one {@link HttpFetchAdapter} per entry under {@code ingestor.sources}.
 */
@Component
@Slf4j
public class FetchAdapterRegistry {

    public static final String RETRY_NAME = "marketFetch";

    private final Map<String, FetchAdapter> adapters = new LinkedHashMap<>();

    public FetchAdapterRegistry(ObjectProvider<FetchAdapter> adapterBeans,
                                IngestorProperties properties,
                                RestTemplate restTemplate,
                                ObjectMapper objectMapper,
                                RetryRegistry retryRegistry) {
        adapterBeans.orderedStream().forEach(this::register);

        Retry retry = retryRegistry.retry(RETRY_NAME);
        properties.getSources().forEach((name, source) ->
                register(new HttpFetchAdapter(name, source, restTemplate, objectMapper, retry)));

        log.info("Fetch adapters registered: {}", adapters.keySet());
    }

    public FetchAdapter get(String source) {
        FetchAdapter adapter = adapters.get(source);
        if (adapter == null) {
            throw new InvalidDatasetException("No fetch adapter registered for source '" + source
                    + "' (known: " + adapters.keySet() + ")");
        }
        return adapter;
    }

    public Map<String, FetchAdapter> all() {
        return Collections.unmodifiableMap(adapters);
    }

    private void register(FetchAdapter adapter) {
        if (adapters.putIfAbsent(adapter.source(), adapter) != null) {
            throw new IllegalStateException("Duplicate fetch adapter for source '" + adapter.source() + "'");
        }
    }
}
