package com.macrointel.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Machine-readable health of one run, consumed by automation and written to
 * the run-health artifact.
 */
@Value
@Builder
public class RunHealthSummary {

    @JsonProperty("run_id")
    String runId;

    @JsonProperty("run_timestamp")
    String runTimestamp;

    String status;

    String mode;

    @JsonProperty("rows_fetched")
    int rowsFetched;

    @JsonProperty("rows_inserted")
    int rowsInserted;

    @JsonProperty("duration_seconds")
    double durationSeconds;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("dq_counts")
    Map<String, Integer> dqCounts;

    @JsonProperty("dq_total")
    int dqTotal;
}
