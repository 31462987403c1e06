package com.macrointel.ingest.output;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class StoreSchema {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring database schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS observations
            (
                series_id           VARCHAR(64)  NOT NULL,
                observation_date    DATE         NOT NULL,
                value               DOUBLE PRECISION,
                load_timestamp      TIMESTAMP    NOT NULL DEFAULT CURRENT_TIMESTAMP,
                PRIMARY KEY (series_id, observation_date)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ingestion_log
            (
                run_id              VARCHAR(64)  NOT NULL PRIMARY KEY,
                run_timestamp       TIMESTAMP    NOT NULL,
                completed_at        TIMESTAMP,
                mode                VARCHAR(16)  NOT NULL,
                series_ingested     TEXT         NOT NULL,
                total_rows_fetched  INTEGER      NOT NULL,
                total_rows_inserted INTEGER      NOT NULL,
                duration_seconds    DOUBLE PRECISION NOT NULL,
                status              VARCHAR(16)  NOT NULL,
                error_message       TEXT
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_ingest_time ON ingestion_log (run_timestamp)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS dq_report
            (
                report_id           VARCHAR(64)  NOT NULL PRIMARY KEY,
                run_id              VARCHAR(64)  NOT NULL,
                finding_timestamp   TIMESTAMP    NOT NULL,
                severity            VARCHAR(16)  NOT NULL,
                code                VARCHAR(64)  NOT NULL,
                series_id           VARCHAR(64),
                message             TEXT         NOT NULL,
                metadata            TEXT
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_dq_run ON dq_report (run_id)");

        log.info("Database schema ready.");
    }
}
