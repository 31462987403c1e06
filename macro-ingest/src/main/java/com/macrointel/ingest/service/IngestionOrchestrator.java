package com.macrointel.ingest.service;

import com.macrointel.ingest.alert.AlertContext;
import com.macrointel.ingest.alert.AlertEngine;
import com.macrointel.ingest.client.SeriesFetchClient;
import com.macrointel.ingest.client.SourceRouter;
import com.macrointel.ingest.config.MacroIngestProperties;
import com.macrointel.ingest.exception.PersistenceException;
import com.macrointel.ingest.exception.QuotaExhaustedException;
import com.macrointel.ingest.model.DataPoint;
import com.macrointel.ingest.model.DataSource;
import com.macrointel.ingest.model.IngestionMode;
import com.macrointel.ingest.model.Observation;
import com.macrointel.ingest.model.RunRecord;
import com.macrointel.ingest.model.RunStatus;
import com.macrointel.ingest.model.SeriesDefinition;
import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;
import com.macrointel.ingest.output.FindingsCsvWriter;
import com.macrointel.ingest.output.ObservationRepository;
import com.macrointel.ingest.output.RunHealthWriter;
import com.macrointel.ingest.output.RunRepository;
import com.macrointel.ingest.service.SeriesFetchOutcome.Degraded;
import com.macrointel.ingest.service.SeriesFetchOutcome.Failed;
import com.macrointel.ingest.service.SeriesFetchOutcome.Fetched;
import com.macrointel.ingest.service.quality.DataQualityValidator;
import com.macrointel.ingest.service.quality.Findings;
import com.macrointel.ingest.service.quality.FreshnessCheck;
import com.macrointel.ingest.service.quality.MissingDataCheck;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs one ingestion cycle end to end: fetch every catalog series from its source,
 * upsert the rows, validate, record the run, then hand the outcome to the alert engine.
 *
 * Per-series and subsystem failures are recorded on the run rather than thrown, so
 * {@link #run(IngestionMode)} always returns a run id. Runs are serialised: the store
 * is written by one run at a time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionOrchestrator {

    private static final Set<String> STALE_CODES = Set.of(FreshnessCheck.STALE_SERIES_DATA);
    private static final Set<String> MISSING_CODES = Set.of(
            FreshnessCheck.SERIES_HAS_NO_OBSERVATIONS, MissingDataCheck.MISSING_SERIES_DATA);

    private final CatalogService catalogService;
    private final SourceRouter sourceRouter;
    private final ObservationRepository observationRepository;
    private final RunRepository runRepository;
    private final DataQualityValidator validator;
    private final AlertEngine alertEngine;
    private final RunHealthWriter runHealthWriter;
    private final FindingsCsvWriter findingsCsvWriter;
    private final MacroIngestProperties properties;
    private final Clock clock;

    public synchronized String run(IngestionMode mode) {
        Instant started = clock.instant();
        RunRecord run = RunRecord.builder()
                .runId(UUID.randomUUID().toString())
                .mode(mode)
                .startedAt(LocalDateTime.now(clock))
                .build();
        List<SeriesDefinition> catalog;
        try {
            catalog = catalogService.getAll();
        } catch (RuntimeException e) {
            log.error("Cannot read series catalog: {}", e.getMessage(), e);
            catalog = List.of();
            run.addFailure("catalog", describe(e));
            run.escalate(RunStatus.FAILED);
        }
        RunContext context = new RunContext(run, catalog);
        log.info("Starting ingestion run {} in {} mode for {} series",
                run.getRunId(), mode.wireName(), context.getCatalog().size());

        try {
            LocalDate today = LocalDate.now(clock);
            LocalDate start = mode.windowStart(today);

            context.enter(RunPhase.FETCHING);
            List<SeriesFetchOutcome> outcomes = fetchAll(context.getCatalog(), start, today);

            context.enter(RunPhase.PERSISTING);
            outcomes.forEach(outcome -> persist(context, outcome));

            context.enter(RunPhase.VALIDATING);
            validate(context);
        } catch (RuntimeException e) {
            log.error("Ingestion run {} aborted in phase {}: {}", run.getRunId(), context.getPhase(), e.getMessage(), e);
            run.addFailure("run", describe(e));
            run.escalate(RunStatus.FAILED);
        }

        context.enter(RunPhase.FINALIZED);
        run.setCompletedAt(LocalDateTime.now(clock));
        run.setDurationSeconds(Duration.between(started, clock.instant()).toMillis() / 1000.0);
        finalizeRun(context);

        writeArtifacts(context);
        raiseAlerts(context);

        log.info("Ingestion run {} complete. Status: {}. Series: {}/{}, rows fetched {}, written {}, degraded {}",
                run.getRunId(), run.getStatus().wireName(), run.getSeriesIngested().size(),
                context.getCatalog().size(), run.getRowsFetched(), run.getRowsWritten(), run.getDegradedSeries());
        return run.getRunId();
    }

    // ── Fetch ────────────────────────────────────────────────────────────────

    private List<SeriesFetchOutcome> fetchAll(List<SeriesDefinition> catalog, LocalDate start, LocalDate end) {
        Map<DataSource, List<SeriesDefinition>> groups = new LinkedHashMap<>();
        for (SeriesDefinition series : catalog) {
            groups.computeIfAbsent(series.getSource(), k -> new ArrayList<>()).add(series);
        }

        MacroIngestProperties.Ingestion ingestion = properties.getIngestion();
        if (!ingestion.isParallelSources() || groups.size() < 2) {
            List<SeriesFetchOutcome> outcomes = new ArrayList<>();
            groups.forEach((source, series) -> outcomes.addAll(fetchGroup(source, series, start, end)));
            return outcomes;
        }
        return fetchGroupsInParallel(groups, Math.max(1, ingestion.getMaxParallelSources()), start, end);
    }

    private List<SeriesFetchOutcome> fetchGroupsInParallel(Map<DataSource, List<SeriesDefinition>> groups,
                                                           int threads, LocalDate start, LocalDate end) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, groups.size()));
        try {
            Map<DataSource, Future<List<SeriesFetchOutcome>>> futures = new LinkedHashMap<>();
            groups.forEach((source, series) ->
                    futures.put(source, pool.submit(() -> fetchGroup(source, series, start, end))));

            List<SeriesFetchOutcome> outcomes = new ArrayList<>();
            for (Map.Entry<DataSource, Future<List<SeriesFetchOutcome>>> entry : futures.entrySet()) {
                try {
                    outcomes.addAll(entry.getValue().get());
                } catch (ExecutionException e) {
                    String error = describe(e.getCause());
                    log.error("Fetch worker for {} failed: {}", entry.getKey(), error, e.getCause());
                    groups.get(entry.getKey()).forEach(s -> outcomes.add(new Failed(s, error)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for " + entry.getKey() + " fetches", e);
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Fetches one source's series in catalog order through the source's single client.
     * Once the provider reports its quota exhausted, that series and every later one go to
     * the configured fallback source.
     */
    List<SeriesFetchOutcome> fetchGroup(DataSource source, List<SeriesDefinition> series,
                                        LocalDate start, LocalDate end) {
        List<SeriesFetchOutcome> outcomes = new ArrayList<>();

        SeriesFetchClient client;
        try {
            client = sourceRouter.clientFor(source);
        } catch (RuntimeException e) {
            log.error("Cannot initialise client for {}: {}. Failing {} series", source, e.getMessage(), series.size());
            series.forEach(s -> outcomes.add(new Failed(s, describe(e))));
            return outcomes;
        }

        DataSource fallback = properties.getIngestion().getFallbackSources().get(source);
        boolean quotaExhausted = false;

        for (SeriesDefinition s : series) {
            if (quotaExhausted) {
                outcomes.add(fetchFromFallback(s, fallback, start, end));
                continue;
            }
            try {
                List<DataPoint> points = client.fetch(s.getSourceSeriesId(), start, end);
                outcomes.add(new Fetched(s, source, points));
            } catch (QuotaExhaustedException e) {
                if (fallback == null) {
                    log.error("Failed to fetch {}: {}", s.getSeriesId(), e.getMessage());
                    outcomes.add(new Failed(s, describe(e)));
                    continue;
                }
                log.warn("{} quota exhausted at {}; re-routing remaining {} series to {}",
                        source, s.getSeriesId(), source, fallback);
                quotaExhausted = true;
                outcomes.add(fetchFromFallback(s, fallback, start, end));
            } catch (RuntimeException e) {
                log.error("Failed to fetch {}: {}", s.getSeriesId(), e.getMessage());
                outcomes.add(new Failed(s, describe(e)));
            }
        }
        return outcomes;
    }

    private SeriesFetchOutcome fetchFromFallback(SeriesDefinition s, DataSource fallback,
                                                 LocalDate start, LocalDate end) {
        try {
            List<DataPoint> points = sourceRouter.clientFor(fallback).fetch(s.getFallbackSeriesId(), start, end);
            if (points.isEmpty()) {
                log.warn("Fallback {} has no data for {} ({})", fallback, s.getSeriesId(), s.getFallbackSeriesId());
                return new Degraded(s, fallback, "no data");
            }
            log.info("Fetched {} via fallback {} as {}", s.getSeriesId(), fallback, s.getFallbackSeriesId());
            return new Fetched(s, fallback, points);
        } catch (RuntimeException e) {
            log.warn("Fallback {} failed for {}: {}", fallback, s.getSeriesId(), e.getMessage());
            return new Degraded(s, fallback, describe(e));
        }
    }

    // ── Persist ──────────────────────────────────────────────────────────────

    private void persist(RunContext context, SeriesFetchOutcome outcome) {
        String seriesId = outcome.series().getSeriesId();
        if (outcome instanceof Failed failed) {
            context.recordFailure(seriesId, failed.error());
            return;
        }
        if (outcome instanceof Degraded degraded) {
            log.warn("Series {} not ingested: {} fallback {}", seriesId, degraded.fallback(), degraded.reason());
            context.recordDegraded(seriesId);
            return;
        }

        Fetched fetched = (Fetched) outcome;
        List<Observation> rows = toObservations(seriesId, fetched.points());
        if (rows.isEmpty()) {
            log.warn("No data found for {}", seriesId);
            context.recordSuccess(seriesId, 0, 0);
            return;
        }

        try {
            int written = observationRepository.upsert(rows);
            context.recordSuccess(seriesId, fetched.points().size(), written);
            log.info("Processed {} from {}: {} rows fetched, {} written",
                    seriesId, fetched.servedBy(), fetched.points().size(), written);
        } catch (PersistenceException e) {
            log.error("Failed to store {}: {}", seriesId, e.getMessage(), e);
            context.recordFailure(seriesId, describe(e));
        }
    }

    /** One row per date; a later point for the same date wins. */
    static List<Observation> toObservations(String seriesId, List<DataPoint> points) {
        Map<LocalDate, Double> byDate = new LinkedHashMap<>();
        for (DataPoint p : points) {
            if (p.date() == null) continue;
            byDate.remove(p.date());
            byDate.put(p.date(), p.value());
        }
        List<Observation> rows = new ArrayList<>(byDate.size());
        byDate.forEach((date, value) -> rows.add(new Observation(seriesId, date, value)));
        return rows;
    }

    // ── Validate & finalise ──────────────────────────────────────────────────

    private void validate(RunContext context) {
        RunRecord run = context.getRun();
        List<ValidationFinding> findings;
        try {
            findings = validator.validate(run.getMode(), context.getCatalog(), context.statsView());
        } catch (RuntimeException e) {
            log.error("DQ validation failed for run {}: {}", run.getRunId(), e.getMessage(), e);
            run.addFailure("dq", "validation failed: " + describe(e));
            run.escalate(RunStatus.PARTIAL);
            return;
        }
        context.setFindings(findings);

        List<ValidationFinding> critical = Findings.ofSeverity(findings, Severity.CRITICAL);
        if (!critical.isEmpty()) {
            run.escalate(RunStatus.FAILED);
            run.addFailure("dq", "critical findings: " + Findings.summarize(critical));
        }
    }

    private void finalizeRun(RunContext context) {
        RunRecord run = context.getRun();
        try {
            runRepository.createRun(run);
        } catch (RuntimeException e) {
            log.error("Failed to record run {}: {}", run.getRunId(), e.getMessage(), e);
            run.addFailure("run_log", describe(e));
            run.escalate(RunStatus.PARTIAL);
            return;
        }

        try {
            runRepository.insertFindings(run.getRunId(), context.getFindings());
        } catch (RuntimeException e) {
            log.error("Failed to persist DQ findings for run {}: {}", run.getRunId(), e.getMessage(), e);
            run.escalate(RunStatus.PARTIAL);
            run.addFailure("dq_persist", describe(e));
            try {
                runRepository.updateRunStatus(run.getRunId(), run.getStatus(), run.errorMessage());
            } catch (RuntimeException patchError) {
                log.error("Failed to patch status of run {}: {}", run.getRunId(), patchError.getMessage(), patchError);
            }
        }
    }

    private void writeArtifacts(RunContext context) {
        RunRecord run = context.getRun();
        try {
            runHealthWriter.write(RunHealthService.fromRecord(run, context.getFindings()));
        } catch (RuntimeException e) {
            log.error("Failed to write run health for {}: {}", run.getRunId(), e.getMessage(), e);
        }

        if (!findingsCsvWriter.isEnabled()) return;
        try {
            findingsCsvWriter.write(run.getRunId(), context.getFindings());
        } catch (RuntimeException e) {
            log.error("Failed to export findings for {}: {}", run.getRunId(), e.getMessage(), e);
        }
    }

    private void raiseAlerts(RunContext context) {
        RunRecord run = context.getRun();
        List<ValidationFinding> findings = context.getFindings();
        AlertContext alertContext = AlertContext.builder()
                .runId(run.getRunId())
                .runStatus(run.getStatus())
                .findings(findings)
                .staleSeries(Findings.seriesWithCodes(findings, STALE_CODES))
                .missingSeries(Findings.seriesWithCodes(findings, MISSING_CODES))
                .totalSeries(context.getCatalog().size())
                .failedSeries(context.getFailedSeries().size())
                .build();
        try {
            alertEngine.checkAndAlert(alertContext);
        } catch (RuntimeException e) {
            log.error("Alert evaluation failed for run {}: {}", run.getRunId(), e.getMessage(), e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
