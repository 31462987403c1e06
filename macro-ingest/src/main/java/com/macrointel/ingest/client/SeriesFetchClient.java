package com.macrointel.ingest.client;

import com.macrointel.ingest.model.DataPoint;
import com.macrointel.ingest.model.DataSource;

import java.time.LocalDate;
import java.util.List;

/**
 * Uniform fetch contract every provider client satisfies.
 *
 * Implementations own their pacing, retry and wire-format parsing. Callers only ever see
 * a list of points or one of the two failure categories:
 * {@link com.macrointel.ingest.exception.TransientFetchException} (already retried) and
 * {@link com.macrointel.ingest.exception.PermanentFetchException}.
 */
public interface SeriesFetchClient {

    DataSource source();

    /**
     * @param requestSeriesId provider-side series id
     * @param start           first date to include
     * @param end             last date to include, or null for open-ended
     * @return points ordered by date ascending, never null
     */
    List<DataPoint> fetch(String requestSeriesId, LocalDate start, LocalDate end);
}
