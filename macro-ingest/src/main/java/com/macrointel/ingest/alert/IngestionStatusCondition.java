package com.macrointel.ingest.alert;

import com.macrointel.ingest.model.RunStatus;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record IngestionStatusCondition(Set<RunStatus> statuses) implements AlertCondition {

    public IngestionStatusCondition {
        statuses = Set.copyOf(statuses);
    }

    @Override
    public ConditionType type() {
        return ConditionType.INGESTION_STATUS;
    }

    @Override
    public Optional<Trigger> evaluate(AlertContext context) {
        RunStatus status = context.getRunStatus();
        if (status == null || !statuses.contains(status)) return Optional.empty();

        String runId = context.getRunId() == null ? "" : context.getRunId();
        return Optional.of(new Trigger(
                "Ingestion run completed with status: " + status.wireName(),
                Map.of("run_id", runId, "status", status.wireName())));
    }
}
