package com.macrointel.ingest.service;

import com.macrointel.ingest.model.RunRecord;
import com.macrointel.ingest.model.RunStatus;
import com.macrointel.ingest.model.SeriesDefinition;
import com.macrointel.ingest.model.SeriesRunStats;
import com.macrointel.ingest.model.ValidationFinding;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one run. Owned by the thread executing the run; never shared.
 */
@Slf4j
@Getter
class RunContext {

    private final RunRecord run;
    private final List<SeriesDefinition> catalog;
    private final Map<String, SeriesRunStats> seriesStats = new LinkedHashMap<>();
    private final Set<String> failedSeries = new LinkedHashSet<>();
    private List<ValidationFinding> findings = new ArrayList<>();
    private RunPhase phase;

    RunContext(RunRecord run, List<SeriesDefinition> catalog) {
        this.run = run;
        this.catalog = catalog;
        catalog.forEach(s -> seriesStats.put(s.getSeriesId(), SeriesRunStats.EMPTY));
        enter(RunPhase.STARTED);
    }

    void enter(RunPhase next) {
        if (phase != null && next.ordinal() <= phase.ordinal()) {
            throw new IllegalStateException("Run " + run.getRunId() + " cannot move from " + phase + " to " + next);
        }
        phase = next;
        log.info("Run {} [{}] -> {}", run.getRunId(), run.getMode().wireName(), next);
    }

    void recordSuccess(String seriesId, int rowsFetched, int rowsWritten) {
        seriesStats.put(seriesId, new SeriesRunStats(rowsFetched, rowsWritten));
        run.getSeriesIngested().add(seriesId);
        run.setRowsFetched(run.getRowsFetched() + rowsFetched);
        run.setRowsWritten(run.getRowsWritten() + rowsWritten);
    }

    void recordFailure(String seriesId, String error) {
        seriesStats.put(seriesId, SeriesRunStats.EMPTY);
        failedSeries.add(seriesId);
        run.addFailure(seriesId, error);
        run.escalate(RunStatus.PARTIAL);
    }

    void recordDegraded(String seriesId) {
        seriesStats.put(seriesId, SeriesRunStats.EMPTY);
        run.getDegradedSeries().add(seriesId);
    }

    void setFindings(List<ValidationFinding> findings) {
        this.findings = List.copyOf(findings);
    }

    Map<String, SeriesRunStats> statsView() {
        return Collections.unmodifiableMap(seriesStats);
    }
}
