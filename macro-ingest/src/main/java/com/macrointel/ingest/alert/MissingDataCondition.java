package com.macrointel.ingest.alert;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record MissingDataCondition(int days) implements AlertCondition {

    @Override
    public ConditionType type() {
        return ConditionType.MISSING_DATA;
    }

    @Override
    public Optional<Trigger> evaluate(AlertContext context) {
        List<String> missing = context.getMissingSeries();
        if (missing.isEmpty()) return Optional.empty();

        return Optional.of(new Trigger(
                missing.size() + " series have no data in the last " + days + " days",
                Map.of("missing_count", missing.size(),
                        "days", days,
                        "series", SeriesPreview.of(missing))));
    }
}
