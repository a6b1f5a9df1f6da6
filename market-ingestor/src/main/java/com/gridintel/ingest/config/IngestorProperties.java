package com.gridintel.ingest.config;

import com.gridintel.ingest.model.PartitionGranularity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "ingestor")
@Data
public class IngestorProperties {

    /** Used by datasets that don't set their own floor. */
    private LocalDateTime epochFloor = LocalDateTime.of(2024, 12, 1, 0, 0);

    private List<DatasetConfig> datasets = new ArrayList<>();
    private Map<String, Source> sources = new LinkedHashMap<>();
    private Pipeline pipeline = new Pipeline();
    private Scheduling scheduling = new Scheduling();
    private Output output = new Output();
    private Http http = new Http();

    @Data
    public static class DatasetConfig {
        private String id;
        private String source;
        private String resource;
        private String groupingKey;
        private List<String> groupingDomain = new ArrayList<>();
        private String table;
        private String zone = "Europe/Prague";
        private Duration resolution = Duration.ofMinutes(1);
        private Duration aggregateInterval = Duration.ofMinutes(15);
        private Duration maxChunkSpan = Duration.ofDays(7);
        private Duration lag = Duration.ofDays(1);
        private LocalDateTime epochFloor;
        private List<String> valueFields = new ArrayList<>();
        private String aggregateField;
        private PartitionGranularity partitionGranularity = PartitionGranularity.MONTH;
        private boolean enabled = true;
    }

    /**
     * Settings for one HTTP upstream. Each entry becomes an HttpFetchAdapter
     * registered under its map key.
     */
    @Data
    public static class Source {
        private String baseUrl;
        private Format format = Format.CSV;
        private char csvSeparator = ',';
        private String timestampField = "timestamp";
        private String timestampPattern = "yyyy-MM-dd'T'HH:mm[:ss]";
        private String groupingKeyField;

        /** Upstream column name -> value field (column) name. */
        private Map<String, String> fieldMapping = new LinkedHashMap<>();

        /** Query parameter names for the request window. */
        private String resourceParam = "resource";
        private String startParam = "from";
        private String endParam = "to";

        public enum Format {
            CSV, JSON
        }
    }

    @Data
    public static class Pipeline {
        private Duration fetchTimeout = Duration.ofMinutes(5);
        private Duration writeTimeout = Duration.ofMinutes(2);
        private int rejectedSampleSize = 5;
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private String userAgent = "gridintel-market-ingestor/1.0";
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private String cron = "0 */15 * * * *";
        private boolean runOnStartup = false;
    }

    @Data
    public static class Output {
        private String auditDir = "./audit";
        private boolean includeHeader = true;
    }
}
