package com.macrointel.ingest.config;

import com.macrointel.ingest.alert.AlertEngine;
import com.macrointel.ingest.alert.DigestSummary;
import com.macrointel.ingest.model.DataSource;
import com.macrointel.ingest.model.IngestionMode;
import com.macrointel.ingest.model.RunHealthSummary;
import com.macrointel.ingest.model.SeriesDefinition;
import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;
import com.macrointel.ingest.output.RunRepository;
import com.macrointel.ingest.service.CatalogService;
import com.macrointel.ingest.service.IngestionOrchestrator;
import com.macrointel.ingest.service.RunHealthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@RestController
@Slf4j
@RequiredArgsConstructor
public class IngestController {

    static final int MAX_FINDINGS_LIMIT = 500;

    private final IngestionOrchestrator orchestrator;
    private final RunHealthService runHealthService;
    private final RunRepository runRepository;
    private final AlertEngine alertEngine;
    private final CatalogService catalogService;

    // ── Ingestion triggers ────────────────────────────────────────────────────

    @PostMapping("/ingest/trigger")
    public ResponseEntity<Map<String, String>> trigger(@RequestParam(defaultValue = "incremental") String mode) {
        IngestionMode parsed;
        try {
            parsed = IngestionMode.parse(mode);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        new Thread(() -> orchestrator.run(parsed), "manual-ingest-" + parsed.wireName()).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "mode", parsed.wireName()));
    }

    // ── Run health ────────────────────────────────────────────────────────────

    @GetMapping("/runs/latest/health")
    public ResponseEntity<?> latestHealth() {
        return healthResponse("latest", runHealthService::latest);
    }

    @GetMapping("/runs/{runId}/health")
    public ResponseEntity<?> runHealth(@PathVariable String runId) {
        return healthResponse(runId, () -> runHealthService.forRun(runId));
    }

    /**
     * GET /runs/{runId}/findings?severity=critical&limit=50
     */
    @GetMapping("/runs/{runId}/findings")
    public ResponseEntity<?> findings(
            @PathVariable String runId,
            @RequestParam(defaultValue = "all") String severity,
            @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_FINDINGS_LIMIT) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be between 1 and " + MAX_FINDINGS_LIMIT));
        }
        try {
            Severity filter = "all".equalsIgnoreCase(severity) ? null : Severity.parse(severity);
            if (runRepository.findRun(runId).isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Unknown run: " + runId));
            }
            List<ValidationFinding> result = runRepository.findFindings(runId, filter, limit);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Findings query failed for run {}: {}", runId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // ── Alerts ────────────────────────────────────────────────────────────────

    @PostMapping("/alerts/digest")
    public ResponseEntity<?> sendDigest() {
        try {
            Optional<DigestSummary> summary = alertEngine.sendDigest();
            return summary.<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.ok(Map.of("status", "empty")));
        } catch (Exception e) {
            log.error("Digest send failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // ── Catalog ───────────────────────────────────────────────────────────────

    /**
     * GET /catalog?source=BLS&tier=1
     */
    @GetMapping("/catalog")
    public ResponseEntity<?> catalog(
            @RequestParam(required = false) String source,
            @RequestParam(required = false) Integer tier) {
        List<SeriesDefinition> series = catalogService.getAll();
        if (source != null) {
            Optional<DataSource> parsed = DataSource.parse(source);
            if (parsed.isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown source: " + source));
            }
            series = catalogService.filterBySource(parsed.get());
        }
        if (tier != null) {
            series = series.stream().filter(s -> s.getTier() == tier).toList();
        }
        return ResponseEntity.ok(series);
    }

    private ResponseEntity<?> healthResponse(String runId, Supplier<Optional<RunHealthSummary>> lookup) {
        try {
            Optional<RunHealthSummary> health = lookup.get();
            if (health.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "No run found: " + runId));
            }
            return ResponseEntity.ok(health.get());
        } catch (Exception e) {
            log.error("Run health query failed for {}: {}", runId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
