package com.macrointel.ingest.output;

import com.macrointel.ingest.model.Observation;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Append-or-replace store of observations keyed by (seriesId, observationDate).
 * All methods throw {@link com.macrointel.ingest.exception.PersistenceException} on store failure.
 */
public interface ObservationRepository {

    /** @return number of rows inserted or replaced */
    int upsert(List<Observation> observations);

    /** Keys that occur more than once; empty while the key invariant holds. */
    List<DuplicateKey> queryDuplicates();

    /** The two most recent observations of a series, if it has any. */
    Optional<LatestPair> latestTwo(String seriesId);

    Optional<LocalDate> latestObservationDate(String seriesId);

    record DuplicateKey(String seriesId, LocalDate observationDate, int count) {}

    /** {@code previous} is null when the series has a single observation. */
    record LatestPair(Observation latest, Observation previous) {}
}
