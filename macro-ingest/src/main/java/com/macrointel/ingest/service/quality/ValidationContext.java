package com.macrointel.ingest.service.quality;

import com.macrointel.ingest.model.IngestionMode;
import com.macrointel.ingest.model.SeriesDefinition;
import com.macrointel.ingest.model.SeriesRunStats;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Inputs shared by every check for one validation pass.
 */
public record ValidationContext(IngestionMode mode,
                                List<SeriesDefinition> configuredSeries,
                                Map<String, SeriesRunStats> seriesStats,
                                LocalDate today) {

    public int rowsFetched(String seriesId) {
        SeriesRunStats stats = seriesStats.get(seriesId);
        return stats == null ? 0 : stats.rowsFetched();
    }
}
