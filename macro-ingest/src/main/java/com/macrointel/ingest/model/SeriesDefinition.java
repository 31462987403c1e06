package com.macrointel.ingest.model;

import lombok.Builder;
import lombok.Value;

/**
 * One tracked series, as declared in the catalog. Read-only for the lifetime of a run.
 */
@Value
@Builder(toBuilder = true)
public class SeriesDefinition {

    /** Internal key. Observations are stored under this id whatever the source calls it. */
    String seriesId;

    DataSource source;

    /** Id sent to the provider; equals {@link #seriesId} unless the catalog overrides it. */
    String sourceSeriesId;

    /** Id used when the series is re-routed to its source's fallback provider. */
    String fallbackSeriesId;

    String frequency;

    int tier;

    String title;
    String units;
    String seasonalAdjustment;
    String description;

    public Frequency frequencyBucket() {
        return Frequency.parse(frequency);
    }
}
