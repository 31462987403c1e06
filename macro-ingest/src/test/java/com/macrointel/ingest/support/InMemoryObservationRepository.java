package com.macrointel.ingest.support;

import com.macrointel.ingest.exception.PersistenceException;
import com.macrointel.ingest.model.Observation;
import com.macrointel.ingest.output.ObservationRepository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Keyed like the real table. Duplicates cannot arise from upserts, so tests inject them directly.
 */
public class InMemoryObservationRepository implements ObservationRepository {

    private final Map<String, NavigableMap<LocalDate, Double>> rows = new HashMap<>();
    private final List<DuplicateKey> injectedDuplicates = new ArrayList<>();
    private final Set<String> failingSeries = new HashSet<>();
    private int upsertCalls;

    public void injectDuplicate(String seriesId, LocalDate date, int count) {
        injectedDuplicates.add(new DuplicateKey(seriesId, date, count));
    }

    public void failUpsertsFor(String seriesId) {
        failingSeries.add(seriesId);
    }

    public void put(String seriesId, LocalDate date, Double value) {
        rows.computeIfAbsent(seriesId, k -> new TreeMap<>()).put(date, value);
    }

    public NavigableMap<LocalDate, Double> rowsFor(String seriesId) {
        return rows.getOrDefault(seriesId, new TreeMap<>());
    }

    public int getUpsertCalls() {
        return upsertCalls;
    }

    @Override
    public int upsert(List<Observation> observations) {
        upsertCalls++;
        for (Observation o : observations) {
            if (failingSeries.contains(o.seriesId())) {
                throw new PersistenceException("Failed to upsert observations for " + o.seriesId(),
                        new IllegalStateException("connection reset"));
            }
        }
        observations.forEach(o -> put(o.seriesId(), o.observationDate(), o.value()));
        return observations.size();
    }

    @Override
    public List<DuplicateKey> queryDuplicates() {
        return List.copyOf(injectedDuplicates);
    }

    @Override
    public Optional<LatestPair> latestTwo(String seriesId) {
        NavigableMap<LocalDate, Double> series = rows.get(seriesId);
        if (series == null || series.isEmpty()) return Optional.empty();

        Map.Entry<LocalDate, Double> latest = series.lastEntry();
        Map.Entry<LocalDate, Double> previous = series.lowerEntry(latest.getKey());
        return Optional.of(new LatestPair(
                new Observation(seriesId, latest.getKey(), latest.getValue()),
                previous == null ? null : new Observation(seriesId, previous.getKey(), previous.getValue())));
    }

    @Override
    public Optional<LocalDate> latestObservationDate(String seriesId) {
        NavigableMap<LocalDate, Double> series = rows.get(seriesId);
        return series == null || series.isEmpty() ? Optional.empty() : Optional.of(series.lastKey());
    }
}
