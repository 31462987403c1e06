package com.macrointel.ingest.scheduler;

import com.macrointel.ingest.alert.AlertEngine;
import com.macrointel.ingest.config.MacroIngestProperties;
import com.macrointel.ingest.model.IngestionMode;
import com.macrointel.ingest.output.StoreSchema;
import com.macrointel.ingest.service.IngestionOrchestrator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup ingestion, plus the daily alert digest.
 *
 * Default schedule: incremental run daily at 06:30 UTC, digest at 08:00 UTC.
 * Override with INGEST_CRON / DIGEST_CRON or the macro-ingest.scheduling.* properties.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestScheduler {

    private final IngestionOrchestrator orchestrator;
    private final AlertEngine alertEngine;
    private final StoreSchema storeSchema;
    private final MacroIngestProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Optionally run ingestion if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            storeSchema.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise database schema: {}", e.getMessage());
        }

        MacroIngestProperties.Scheduling scheduling = properties.getScheduling();
        if (scheduling.isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running {} ingestion", scheduling.getStartupMode());
            try {
                orchestrator.run(IngestionMode.parse(scheduling.getStartupMode()));
            } catch (Exception e) {
                log.error("Startup ingestion failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Ingest service ready. Next scheduled run: {}", scheduling.getCron());
        }
    }

    @Scheduled(cron = "${macro-ingest.scheduling.cron:0 30 6 * * ?}", zone = "UTC")
    public void scheduledIngest() {
        log.info("Scheduled incremental ingestion triggered");
        try {
            orchestrator.run(IngestionMode.INCREMENTAL);
        } catch (Exception e) {
            log.error("Scheduled ingestion failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${macro-ingest.scheduling.digest-cron:0 0 8 * * ?}", zone = "UTC")
    public void scheduledDigest() {
        try {
            alertEngine.sendDigest().ifPresentOrElse(
                    summary -> log.info("Daily digest sent: {} alert(s)", summary.totalCount()),
                    () -> log.info("Daily digest skipped: no buffered alerts"));
        } catch (Exception e) {
            log.error("Daily digest failed: {}", e.getMessage(), e);
        }
    }
}
