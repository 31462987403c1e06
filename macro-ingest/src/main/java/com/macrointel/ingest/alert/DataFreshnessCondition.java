package com.macrointel.ingest.alert;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fires when the caller reports any stale series. {@code maxAgeDays} is only used in the message.
 */
public record DataFreshnessCondition(int maxAgeDays) implements AlertCondition {

    @Override
    public ConditionType type() {
        return ConditionType.DATA_FRESHNESS;
    }

    @Override
    public Optional<Trigger> evaluate(AlertContext context) {
        List<String> stale = context.getStaleSeries();
        if (stale.isEmpty()) return Optional.empty();

        return Optional.of(new Trigger(
                stale.size() + " series haven't been updated in " + maxAgeDays + " days",
                Map.of("stale_count", stale.size(),
                        "max_age_days", maxAgeDays,
                        "series", SeriesPreview.of(stale))));
    }
}
