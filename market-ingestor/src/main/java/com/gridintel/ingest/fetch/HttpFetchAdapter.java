package com.gridintel.ingest.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridintel.ingest.config.IngestorProperties;
import com.gridintel.ingest.exception.FetchException;
import com.gridintel.ingest.exception.PermanentFetchException;
import com.gridintel.ingest.exception.TransientFetchException;
import com.gridintel.ingest.model.TimeRange;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.StringReader;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches a time window from an HTTP endpoint that answers with CSV or a JSON array.
 *
 * One instance per configured source. The request is
 * {@code GET baseUrl?resource=..&from=..&to=..} with ISO local timestamps; parameter
 * names come from the source config. Transient failures (I/O, 429, 5xx) go through the
 * shared Resilience4j retry; 404 and other 4xx are permanent for the chunk.
 */
@Slf4j
public class HttpFetchAdapter implements FetchAdapter {

    private static final DateTimeFormatter WINDOW_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final String name;
    private final IngestorProperties.Source source;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Retry retry;
    private final RecordParser parser;

    public HttpFetchAdapter(String name,
                            IngestorProperties.Source source,
                            RestTemplate restTemplate,
                            ObjectMapper objectMapper,
                            Retry retry) {
        this.name = name;
        this.source = source;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.retry = retry;
        this.parser = new FieldMappingRecordParser(source);
    }

    @Override
    public String source() {
        return name;
    }

    @Override
    public RecordParser parser() {
        return parser;
    }

    @Override
    public List<RawFields> fetch(String resource, TimeRange range) throws FetchException {
        String url = UriComponentsBuilder
                .fromHttpUrl(source.getBaseUrl())
                .queryParam(source.getResourceParam(), resource)
                .queryParam(source.getStartParam(), WINDOW_FORMAT.format(range.start()))
                .queryParam(source.getEndParam(), WINDOW_FORMAT.format(range.end()))
                .toUriString();

        try {
            return retry.executeCallable(() -> download(url));
        } catch (FetchException e) {
            throw e;
        } catch (Exception e) {
            throw new TransientFetchException("Fetch from " + name + " failed: " + e.getMessage(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<RawFields> download(String url) throws FetchException {
        log.debug("Calling {}: {}", name, url);

        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(url, String.class);
        } catch (HttpClientErrorException.NotFound e) {
            throw new PermanentFetchException("No such resource (404) at " + url, e);
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by {}", name);
            throw new TransientFetchException("Rate limited (429) at " + url, e);
        } catch (HttpClientErrorException e) {
            throw new PermanentFetchException("Rejected (" + e.getStatusCode().value() + ") at " + url, e);
        } catch (HttpServerErrorException e) {
            throw new TransientFetchException("Upstream error (" + e.getStatusCode().value() + ") at " + url, e);
        } catch (ResourceAccessException e) {
            throw new TransientFetchException("I/O error calling " + url + ": " + e.getMessage(), e);
        }

        String body = response.getBody();
        if (body == null || body.isBlank()) return List.of();

        List<RawFields> rows = source.getFormat() == IngestorProperties.Source.Format.JSON
                ? parseJson(body, url)
                : parseCsv(body, url);
        log.debug("{} returned {} row(s)", name, rows.size());
        return rows;
    }

    private List<RawFields> parseCsv(String body, String url) throws FetchException {
        List<String[]> lines;
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(body))
                .withCSVParser(new CSVParserBuilder().withSeparator(source.getCsvSeparator()).build())
                .build()) {
            lines = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new PermanentFetchException("Malformed CSV from " + url + ": " + e.getMessage(), e);
        }
        if (lines.isEmpty()) return List.of();

        String[] header = lines.get(0);
        for (int c = 0; c < header.length; c++) {
            header[c] = header[c].trim();
        }

        List<RawFields> rows = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String[] cols = lines.get(i);
            if (cols.length == 1 && cols[0].isBlank()) continue;

            Map<String, String> fields = new LinkedHashMap<>();
            for (int c = 0; c < header.length; c++) {
                fields.put(header[c], c < cols.length ? cols[c] : null);
            }
            rows.add(new RawFields(i, fields));
        }
        return rows;
    }

    private List<RawFields> parseJson(String body, String url) throws FetchException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PermanentFetchException("Malformed JSON from " + url + ": " + e.getOriginalMessage(), e);
        }

        JsonNode array = root.isArray() ? root : firstArray(root);
        if (array == null) {
            throw new PermanentFetchException("JSON from " + url + " holds no array of rows");
        }

        List<RawFields> rows = new ArrayList<>();
        int ordinal = 0;
        for (JsonNode node : array) {
            ordinal++;
            if (!node.isObject()) continue;

            Map<String, String> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                JsonNode value = entry.getValue();
                fields.put(entry.getKey(), value == null || value.isNull() ? null : value.asText());
            }
            rows.add(new RawFields(ordinal, fields));
        }
        return rows;
    }

    // Envelopes like {"data": [...]}
    private static JsonNode firstArray(JsonNode root) {
        Iterator<JsonNode> it = root.elements();
        while (it.hasNext()) {
            JsonNode child = it.next();
            if (child.isArray()) return child;
        }
        return null;
    }
}
