package com.macrointel.ingest.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One ingestion execution. Mutated by the orchestrator while the run is in progress,
 * written to the ingestion_log table once it is finalized.
 */
@Data
@Builder
public class RunRecord {

    private String runId;
    private IngestionMode mode;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private List<String> seriesIngested = new ArrayList<>();

    /** Series re-routed to a fallback source that had no data for them either. */
    @Builder.Default
    private List<String> degradedSeries = new ArrayList<>();

    private int rowsFetched;
    private int rowsWritten;
    private double durationSeconds;

    @Builder.Default
    private RunStatus status = RunStatus.SUCCESS;

    @Builder.Default
    private List<RunFailure> failures = new ArrayList<>();

    public void escalate(RunStatus target) {
        status = status.escalate(target);
    }

    public void addFailure(String scope, String message) {
        failures.add(new RunFailure(scope, message));
    }

    /**
     * Single human-readable error string, as stored and displayed. Null when the
     * run recorded no failures.
     */
    public String errorMessage() {
        if (failures.isEmpty()) return null;
        return failures.stream().map(RunFailure::render).collect(Collectors.joining("; "));
    }
}
