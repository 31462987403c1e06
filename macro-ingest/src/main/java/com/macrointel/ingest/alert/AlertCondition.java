package com.macrointel.ingest.alert;

import java.util.Map;
import java.util.Optional;

/**
 * What makes a rule fire. Each kind carries its own typed parameters.
 */
public sealed interface AlertCondition
        permits IngestionStatusCondition, DqCountCondition, DataFreshnessCondition,
        MissingDataCondition, ErrorRateCondition {

    ConditionType type();

    /** Empty when the condition does not hold for {@code context}. */
    Optional<Trigger> evaluate(AlertContext context);

    record Trigger(String details, Map<String, Object> metadata) {}
}
