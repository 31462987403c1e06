package com.macrointel.ingest.service;

import com.macrointel.ingest.config.MacroIngestProperties;
import com.macrointel.ingest.model.DataSource;
import com.macrointel.ingest.model.SeriesDefinition;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Holds the configured series. The snapshot is an immutable list swapped atomically
 * on {@link #reload()}, so concurrent readers always see one consistent catalog.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CatalogService {

    private final SeriesCatalogLoader loader;
    private final MacroIngestProperties properties;

    private volatile List<SeriesDefinition> series = List.of();

    /** Fails application startup on an invalid catalog. */
    @PostConstruct
    public void reload() {
        series = loader.load(properties.getCatalog().getPath());
    }

    public List<SeriesDefinition> getAll() {
        return series;
    }

    public List<SeriesDefinition> filterBySource(DataSource source) {
        return series.stream().filter(s -> s.getSource() == source).toList();
    }

    public List<SeriesDefinition> filterByTier(int tier) {
        return series.stream().filter(s -> s.getTier() == tier).toList();
    }

    public Optional<SeriesDefinition> get(String seriesId) {
        return series.stream().filter(s -> s.getSeriesId().equals(seriesId)).findFirst();
    }
}
