package com.macrointel.ingest.service;

import com.macrointel.ingest.model.RunHealthSummary;
import com.macrointel.ingest.model.RunRecord;
import com.macrointel.ingest.model.ValidationFinding;
import com.macrointel.ingest.output.RunRepository;
import com.macrointel.ingest.output.RunRepository.StoredRun;
import com.macrointel.ingest.service.quality.Findings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link RunHealthSummary} views, either from a run still in memory or from the run log.
 */
@Service
@RequiredArgsConstructor
public class RunHealthService {

    private final RunRepository runRepository;

    public Optional<RunHealthSummary> latest() {
        return runRepository.findLatestRunId().flatMap(this::forRun);
    }

    public Optional<RunHealthSummary> forRun(String runId) {
        return runRepository.findRun(runId).map(run -> fromStored(run, runRepository.countFindingsBySeverity(runId)));
    }

    public static RunHealthSummary fromRecord(RunRecord run, List<ValidationFinding> findings) {
        Map<String, Integer> counts = Findings.countBySeverity(findings);
        return RunHealthSummary.builder()
                .runId(run.getRunId())
                .runTimestamp(run.getStartedAt() == null ? null : run.getStartedAt().toString())
                .status(run.getStatus().wireName())
                .mode(run.getMode().wireName())
                .rowsFetched(run.getRowsFetched())
                .rowsInserted(run.getRowsWritten())
                .durationSeconds(run.getDurationSeconds())
                .errorMessage(run.errorMessage())
                .dqCounts(counts)
                .dqTotal(findings.size())
                .build();
    }

    static RunHealthSummary fromStored(StoredRun run, Map<String, Integer> counts) {
        return RunHealthSummary.builder()
                .runId(run.runId())
                .runTimestamp(run.runTimestamp() == null ? null : run.runTimestamp().toString())
                .status(run.status())
                .mode(run.mode())
                .rowsFetched(run.rowsFetched())
                .rowsInserted(run.rowsInserted())
                .durationSeconds(run.durationSeconds())
                .errorMessage(run.errorMessage())
                .dqCounts(counts)
                .dqTotal(counts.values().stream().mapToInt(Integer::intValue).sum())
                .build();
    }
}
