package com.gridintel.ingest.scheduler;

import com.gridintel.ingest.config.IngestorProperties;
import com.gridintel.ingest.exception.IngestException;
import com.gridintel.ingest.model.Dataset;
import com.gridintel.ingest.model.IngestionReport;
import com.gridintel.ingest.service.DatasetRegistry;
import com.gridintel.ingest.service.IngestionPipeline;
import com.gridintel.ingest.store.StoreSchema;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup ingestion.
 *
 * Default schedule: every 15 minutes. Each tick runs auto mode for every enabled
 * dataset in turn; most ticks are no-ops because the datasets are already caught up
 * to now minus lag. One dataset failing never stops the others.
 *
 * Override with the INGEST_CRON env var or the ingestor.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestScheduler {

    private final IngestionPipeline pipeline;
    private final DatasetRegistry datasets;
    private final StoreSchema schema;
    private final IngestorProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the bookkeeping tables exist
     *  2. Optionally run auto mode once if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            schema.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise ingestion schema (store unreachable?): {}", e.getMessage());
        }

        if (!properties.getScheduling().isEnabled()) {
            log.info("Scheduled ingestion disabled");
            return;
        }
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, ingesting {} dataset(s) now", datasets.all().size());
            ingestAll();
        } else {
            log.info("Ingestor ready. Schedule: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${ingestor.scheduling.cron:0 */15 * * * *}")
    public void scheduledIngest() {
        if (!properties.getScheduling().isEnabled()) return;
        log.info("Scheduled ingestion triggered");
        ingestAll();
    }

    void ingestAll() {
        int failed = 0;
        for (Dataset dataset : datasets.all()) {
            try {
                IngestionReport report = pipeline.run(dataset.getId());
                if (report.needsAttention()) failed++;
            } catch (IngestException e) {
                failed++;
                log.error("Scheduled ingestion of {} failed: {}", dataset.getId(), e.getMessage());
            } catch (Exception e) {
                failed++;
                log.error("Scheduled ingestion of {} failed unexpectedly: {}", dataset.getId(), e.getMessage(), e);
            }
        }
        if (failed > 0) {
            log.warn("Scheduled ingestion finished with {} dataset(s) needing attention", failed);
        }
    }
}
