package com.macrointel.ingest.alert;

import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.service.quality.Findings;

import java.util.Map;
import java.util.Optional;

public record DqCountCondition(Severity severity, ComparisonOperator operator, int threshold)
        implements AlertCondition {

    @Override
    public ConditionType type() {
        return ConditionType.DQ_COUNT;
    }

    @Override
    public Optional<Trigger> evaluate(AlertContext context) {
        long count = Findings.count(context.getFindings(), severity);
        if (!operator.test(count, threshold)) return Optional.empty();

        return Optional.of(new Trigger(
                count + " " + severity.wireName() + " DQ findings detected (threshold: " + threshold + ")",
                Map.of("count", count, "severity", severity.wireName(), "threshold", threshold)));
    }
}
