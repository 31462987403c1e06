package com.macrointel.ingest.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.macrointel.ingest.exception.PersistenceException;
import com.macrointel.ingest.model.RunRecord;
import com.macrointel.ingest.model.RunStatus;
import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcRunRepository implements RunRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void createRun(RunRecord run) {
        try {
            jdbcTemplate.update("""
                INSERT INTO ingestion_log
                (run_id, run_timestamp, completed_at, mode, series_ingested,
                 total_rows_fetched, total_rows_inserted, duration_seconds, status, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    run.getRunId(),
                    Timestamp.valueOf(run.getStartedAt()),
                    run.getCompletedAt() != null ? Timestamp.valueOf(run.getCompletedAt()) : null,
                    run.getMode().wireName(),
                    toJson(run.getSeriesIngested()),
                    run.getRowsFetched(),
                    run.getRowsWritten(),
                    run.getDurationSeconds(),
                    run.getStatus().wireName(),
                    run.errorMessage());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to write run " + run.getRunId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void updateRunStatus(String runId, RunStatus status, String errorMessage) {
        try {
            jdbcTemplate.update("UPDATE ingestion_log SET status = ?, error_message = ? WHERE run_id = ?",
                    status.wireName(), errorMessage, runId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to update run " + runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void insertFindings(String runId, List<ValidationFinding> findings) {
        if (findings.isEmpty()) return;

        Timestamp now = Timestamp.valueOf(LocalDateTime.now(clock));
        try {
            jdbcTemplate.batchUpdate("""
                INSERT INTO dq_report
                (report_id, run_id, finding_timestamp, severity, code, series_id, message, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """, findings, findings.size(), (ps, f) -> {
                ps.setString(1, UUID.randomUUID().toString());
                ps.setString(2, runId);
                ps.setTimestamp(3, now);
                ps.setString(4, f.getSeverity().wireName());
                ps.setString(5, f.getCode());
                ps.setString(6, f.getSeriesId());
                ps.setString(7, f.getMessage());
                ps.setString(8, f.getMetadata() == null || f.getMetadata().isEmpty() ? null : toJson(f.getMetadata()));
            });
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to write " + findings.size() + " findings for run "
                    + runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<StoredRun> findRun(String runId) {
        try {
            List<StoredRun> rows = jdbcTemplate.query("""
                SELECT run_id, run_timestamp, mode, status, total_rows_fetched, total_rows_inserted,
                       duration_seconds, error_message
                FROM ingestion_log
                WHERE run_id = ?
                """, this::mapRun, runId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read run " + runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> findLatestRunId() {
        try {
            List<String> ids = jdbcTemplate.queryForList(
                    "SELECT run_id FROM ingestion_log ORDER BY run_timestamp DESC LIMIT 1", String.class);
            return ids.stream().findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read latest run: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Integer> countFindingsBySeverity(String runId) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Severity s : Severity.values()) {
            counts.put(s.wireName(), 0);
        }
        try {
            jdbcTemplate.query("SELECT severity, COUNT(*) AS cnt FROM dq_report WHERE run_id = ? GROUP BY severity",
                    rs -> {
                        counts.put(rs.getString("severity"), rs.getInt("cnt"));
                    }, runId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to count findings for run " + runId + ": " + e.getMessage(), e);
        }
        return counts;
    }

    @Override
    public List<ValidationFinding> findFindings(String runId, Severity severity, int limit) {
        StringBuilder sql = new StringBuilder("""
            SELECT severity, code, series_id, message, metadata
            FROM dq_report
            WHERE run_id = ?
            """);
        List<Object> params = new ArrayList<>();
        params.add(runId);
        if (severity != null) {
            sql.append(" AND severity = ?");
            params.add(severity.wireName());
        }
        sql.append(" ORDER BY finding_timestamp DESC LIMIT ?");
        params.add(limit);

        try {
            return jdbcTemplate.query(sql.toString(), (rs, i) -> ValidationFinding.builder()
                    .severity(Severity.parse(rs.getString("severity")))
                    .code(rs.getString("code"))
                    .seriesId(rs.getString("series_id"))
                    .message(rs.getString("message"))
                    .metadata(fromJson(rs.getString("metadata")))
                    .build(), params.toArray());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read findings for run " + runId + ": " + e.getMessage(), e);
        }
    }

    private StoredRun mapRun(ResultSet rs, int rowNum) throws SQLException {
        Timestamp ts = rs.getTimestamp("run_timestamp");
        return new StoredRun(
                rs.getString("run_id"),
                ts != null ? ts.toLocalDateTime() : null,
                rs.getString("mode"),
                rs.getString("status"),
                rs.getInt("total_rows_fetched"),
                rs.getInt("total_rows_inserted"),
                rs.getDouble("duration_seconds"),
                rs.getString("error_message"));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise " + value.getClass().getSimpleName(), e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable finding metadata '{}': {}", json, e.getMessage());
            return Map.of("raw", json);
        }
    }
}
