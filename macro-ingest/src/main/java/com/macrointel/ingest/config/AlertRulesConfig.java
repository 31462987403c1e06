package com.macrointel.ingest.config;

import com.macrointel.ingest.alert.AlertCondition;
import com.macrointel.ingest.alert.AlertEngine;
import com.macrointel.ingest.alert.AlertHandler;
import com.macrointel.ingest.alert.AlertRule;
import com.macrointel.ingest.alert.ComparisonOperator;
import com.macrointel.ingest.alert.ConditionType;
import com.macrointel.ingest.alert.DataFreshnessCondition;
import com.macrointel.ingest.alert.DqCountCondition;
import com.macrointel.ingest.alert.ErrorRateCondition;
import com.macrointel.ingest.alert.IngestionStatusCondition;
import com.macrointel.ingest.alert.MissingDataCondition;
import com.macrointel.ingest.exception.ConfigurationException;
import com.macrointel.ingest.model.RunStatus;
import com.macrointel.ingest.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns {@code macro-ingest.alerts.rules} into typed {@link AlertRule}s once at startup.
 * Any invalid rule aborts startup.
 */
@Slf4j
@Configuration
public class AlertRulesConfig {

    static final double DEFAULT_DQ_THRESHOLD = 1;
    static final double DEFAULT_ERROR_RATE_THRESHOLD = 0.20;

    @Bean
    public AlertEngine alertEngine(MacroIngestProperties properties, List<AlertHandler> handlers, Clock clock) {
        MacroIngestProperties.Alerts alerts = properties.getAlerts();
        List<AlertRule> rules = buildRules(alerts.getRules(), clock);
        log.info("Alert engine: {} rule(s), handlers {}, dispatch mode {}",
                rules.size(), handlers.stream().map(AlertHandler::name).toList(), alerts.getDispatchMode());
        return new AlertEngine(rules, handlers, alerts.getDispatchMode(), clock);
    }

    public static List<AlertRule> buildRules(List<MacroIngestProperties.Alerts.Rule> configured, Clock clock) {
        List<AlertRule> rules = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (MacroIngestProperties.Alerts.Rule rule : configured) {
            if (rule.getName() == null || rule.getName().isBlank()) {
                throw new ConfigurationException("Alert rule is missing a name");
            }
            if (!names.add(rule.getName())) {
                throw new ConfigurationException("Duplicate alert rule name: " + rule.getName());
            }
            if (rule.getCooldownHours() < 0) {
                throw new ConfigurationException("Alert rule " + rule.getName() + " has a negative cooldown");
            }
            try {
                rules.add(new AlertRule(
                        rule.getName(),
                        rule.isEnabled(),
                        Severity.parse(rule.getSeverity()),
                        rule.getDescription(),
                        buildCondition(rule.getCondition()),
                        rule.getCooldownHours(),
                        clock));
            } catch (IllegalArgumentException | ConfigurationException e) {
                throw new ConfigurationException("Alert rule " + rule.getName() + ": " + e.getMessage(), e);
            }
        }
        return rules;
    }

    public static AlertCondition buildCondition(MacroIngestProperties.Alerts.Condition condition) {
        if (condition == null) {
            throw new ConfigurationException("condition is required");
        }
        ConditionType type = ConditionType.parse(condition.getType());
        return switch (type) {
            case INGESTION_STATUS -> {
                if (condition.getStatuses().isEmpty()) {
                    throw new ConfigurationException("ingestion_status condition needs at least one status");
                }
                Set<RunStatus> statuses = new HashSet<>();
                condition.getStatuses().forEach(s -> statuses.add(RunStatus.parse(s)));
                yield new IngestionStatusCondition(statuses);
            }
            case DQ_COUNT -> {
                double threshold = condition.getThreshold() == null ? DEFAULT_DQ_THRESHOLD : condition.getThreshold();
                if (threshold < 0 || threshold != Math.rint(threshold)) {
                    throw new ConfigurationException("dq_count threshold must be a non-negative whole number");
                }
                yield new DqCountCondition(
                        Severity.parse(condition.getSeverity()),
                        ComparisonOperator.parse(condition.getOperator()),
                        (int) threshold);
            }
            case DATA_FRESHNESS -> new DataFreshnessCondition(condition.getMaxAgeDays());
            case MISSING_DATA -> new MissingDataCondition(condition.getDays());
            case ERROR_RATE -> new ErrorRateCondition(
                    ComparisonOperator.parse(condition.getOperator()),
                    condition.getThreshold() == null ? DEFAULT_ERROR_RATE_THRESHOLD : condition.getThreshold());
        };
    }
}
