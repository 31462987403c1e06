package com.macrointel.ingest.alert;

import com.macrointel.ingest.exception.ConfigurationException;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Share of failed series in the run. Never fires for an empty run.
 */
public record ErrorRateCondition(ComparisonOperator operator, double threshold) implements AlertCondition {

    public ErrorRateCondition {
        if (operator == ComparisonOperator.EQUAL) {
            throw new ConfigurationException("error_rate conditions support only '>=' and '>'");
        }
    }

    @Override
    public ConditionType type() {
        return ConditionType.ERROR_RATE;
    }

    @Override
    public Optional<Trigger> evaluate(AlertContext context) {
        int total = context.getTotalSeries();
        if (total == 0) return Optional.empty();

        int failed = context.getFailedSeries();
        double errorRate = (double) failed / total;
        if (!operator.test(errorRate, threshold)) return Optional.empty();

        return Optional.of(new Trigger(
                String.format(Locale.ROOT, "High API error rate: %.1f%% (%d/%d series failed)",
                        errorRate * 100.0, failed, total),
                Map.of("error_rate", errorRate, "failed", failed, "total", total)));
    }
}
