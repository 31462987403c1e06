package com.macrointel.ingest.output;

import com.macrointel.ingest.model.RunRecord;
import com.macrointel.ingest.model.RunStatus;
import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run log and DQ report storage.
 * All methods throw {@link com.macrointel.ingest.exception.PersistenceException} on store failure.
 */
public interface RunRepository {

    void createRun(RunRecord run);

    void updateRunStatus(String runId, RunStatus status, String errorMessage);

    void insertFindings(String runId, List<ValidationFinding> findings);

    Optional<StoredRun> findRun(String runId);

    Optional<String> findLatestRunId();

    /** Always contains info, warning and critical keys. */
    Map<String, Integer> countFindingsBySeverity(String runId);

    /** @param severity null for every severity */
    List<ValidationFinding> findFindings(String runId, Severity severity, int limit);

    record StoredRun(String runId,
                     LocalDateTime runTimestamp,
                     String mode,
                     String status,
                     int rowsFetched,
                     int rowsInserted,
                     double durationSeconds,
                     String errorMessage) {}
}
