package com.gridintel.ingest.output;

import com.gridintel.ingest.config.IngestorProperties;
import com.gridintel.ingest.exception.IngestException;
import com.gridintel.ingest.model.AuditReport;
import com.gridintel.ingest.model.DayAudit;
import com.gridintel.ingest.model.MissingRange;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Collectors;

/**
 * Exports an audit report as CSV, one row per civil day.
 *
 * Output path pattern: {auditDir}/audit_{dataset}_{from}_{to}.csv
 * e.g. ./audit/audit_ceps-imbalance_2025-11-01_2025-11-07.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AuditCsvWriter {

    private final IngestorProperties properties;

    private static final String[] HEADERS = {
            "date",
            "raw_count", "expected_raw_count",
            "aggregate_count", "expected_aggregate_count",
            "missing_count", "missing_ranges",
            "null_counts",
            "raw_only", "aggregate_only",
            "complete"
    };

    public Path write(AuditReport report) {
        Path outputDir = Paths.get(properties.getOutput().getAuditDir());
        ensureDirectory(outputDir);

        String filename = String.format("audit_%s_%s_%s.csv", report.getDatasetId(), report.getFrom(), report.getTo());
        Path outputPath = outputDir.resolve(filename);

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (DayAudit day : report.getDays()) {
                writer.writeNext(toRow(report, day));
            }

            log.info("Written audit of {} day(s) to CSV: {}", report.getDays().size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write audit CSV {}: {}", outputPath, e.getMessage(), e);
            throw new IngestException("Audit CSV write failed: " + outputPath, e);
        }
    }

    private String[] toRow(AuditReport report, DayAudit day) {
        return new String[]{
                day.getDate().toString(),
                String.valueOf(day.getRawCount()),
                String.valueOf(day.getExpectedRawCount()),
                String.valueOf(day.getAggregateCount()),
                String.valueOf(day.getExpectedAggregateCount()),
                String.valueOf(day.missingCount()),
                day.getMissingRanges().stream()
                        .map(MissingRange::toString)
                        .collect(Collectors.joining("; ")),
                day.getNullCounts().entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining("; ")),
                String.valueOf(report.getRawOnlyDates().contains(day.getDate())),
                String.valueOf(report.getAggregateOnlyDates().contains(day.getDate())),
                String.valueOf(day.isComplete())
        };
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IngestException("Cannot create audit directory: " + dir, e);
        }
    }
}
