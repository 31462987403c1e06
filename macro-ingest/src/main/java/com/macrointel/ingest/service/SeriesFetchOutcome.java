package com.macrointel.ingest.service;

import com.macrointel.ingest.model.DataPoint;
import com.macrointel.ingest.model.DataSource;
import com.macrointel.ingest.model.SeriesDefinition;

import java.util.List;

/**
 * Result of fetching one series, before anything is persisted.
 */
sealed interface SeriesFetchOutcome {

    SeriesDefinition series();

    /** Data came back, possibly empty, from {@code servedBy}. */
    record Fetched(SeriesDefinition series, DataSource servedBy, List<DataPoint> points) implements SeriesFetchOutcome {}

    /** Counts against the run status. */
    record Failed(SeriesDefinition series, String error) implements SeriesFetchOutcome {}

    /** Re-routed after a quota failure and the fallback had nothing either. Does not count against the run. */
    record Degraded(SeriesDefinition series, DataSource fallback, String reason) implements SeriesFetchOutcome {}
}
