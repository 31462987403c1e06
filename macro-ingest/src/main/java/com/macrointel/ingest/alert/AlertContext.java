package com.macrointel.ingest.alert;

import com.macrointel.ingest.model.RunStatus;
import com.macrointel.ingest.model.ValidationFinding;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the rules may look at after one run. Stale and missing series are
 * computed by the caller; rules never query the store.
 */
@Value
@Builder
public class AlertContext {

    String runId;
    RunStatus runStatus;

    @Singular
    List<ValidationFinding> findings;

    @Singular("staleSeriesId")
    List<String> staleSeries;

    @Singular("missingSeriesId")
    List<String> missingSeries;

    int totalSeries;
    int failedSeries;
}
