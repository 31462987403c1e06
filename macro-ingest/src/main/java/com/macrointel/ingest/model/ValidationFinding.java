package com.macrointel.ingest.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One data-quality observation produced at the end of a run. Immutable.
 */
@Value
@Builder
public class ValidationFinding {

    Severity severity;

    /** Stable machine-readable identifier, e.g. {@code stale_series_data}. */
    String code;

    String message;

    /** Null for run-wide findings. */
    String seriesId;

    @Singular("meta")
    Map<String, Object> metadata;
}
