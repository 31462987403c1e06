package com.macrointel.ingest.config;

import com.macrointel.ingest.alert.AlertRule;
import com.macrointel.ingest.alert.ComparisonOperator;
import com.macrointel.ingest.alert.DqCountCondition;
import com.macrointel.ingest.alert.ErrorRateCondition;
import com.macrointel.ingest.alert.IngestionStatusCondition;
import com.macrointel.ingest.exception.ConfigurationException;
import com.macrointel.ingest.model.RunStatus;
import com.macrointel.ingest.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AlertRulesConfig Tests")
class AlertRulesConfigTest {

    private static MacroIngestProperties.Alerts.Rule rule(String name, String type) {
        MacroIngestProperties.Alerts.Rule rule = new MacroIngestProperties.Alerts.Rule();
        rule.setName(name);
        rule.getCondition().setType(type);
        return rule;
    }

    @Test
    @DisplayName("Configured rules become typed conditions")
    void testBuildRules() {
        MacroIngestProperties.Alerts.Rule status = rule("ingestion_failed", "ingestion_status");
        status.setSeverity("critical");
        status.getCondition().setStatuses(List.of("failed", "partial"));
        MacroIngestProperties.Alerts.Rule dq = rule("critical_dq", "dq_count");
        dq.getCondition().setThreshold(2.0);
        dq.getCondition().setOperator(">");

        List<AlertRule> rules = AlertRulesConfig.buildRules(List.of(status, dq), Clock.systemUTC());

        assertEquals(2, rules.size());
        assertEquals(Severity.CRITICAL, rules.get(0).getSeverity());
        assertEquals(new IngestionStatusCondition(Set.of(RunStatus.FAILED, RunStatus.PARTIAL)),
                rules.get(0).getCondition());
        assertEquals(new DqCountCondition(Severity.CRITICAL, ComparisonOperator.GREATER, 2),
                rules.get(1).getCondition());
    }

    @Test
    @DisplayName("error_rate defaults to a 20% threshold")
    void testErrorRateDefaults() {
        AlertRule rule = AlertRulesConfig.buildRules(List.of(rule("errors", "error_rate")), Clock.systemUTC()).get(0);

        assertEquals(new ErrorRateCondition(ComparisonOperator.GREATER_OR_EQUAL, 0.20), rule.getCondition());
    }

    @Test
    @DisplayName("Unknown condition type is a configuration error")
    void testUnknownType() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> AlertRulesConfig.buildRules(List.of(rule("bad", "moon_phase")), Clock.systemUTC()));
        assertTrue(e.getMessage().contains("bad"));
        assertEquals("CFG-001", e.getErrorCode());
    }

    @Test
    @DisplayName("Equality operator is rejected for error_rate")
    void testErrorRateEquality() {
        MacroIngestProperties.Alerts.Rule rule = rule("errors", "error_rate");
        rule.getCondition().setOperator("=");

        assertThrows(ConfigurationException.class,
                () -> AlertRulesConfig.buildRules(List.of(rule), Clock.systemUTC()));
    }

    @Test
    @DisplayName("Unknown severity, operator or status is rejected")
    void testInvalidValues() {
        MacroIngestProperties.Alerts.Rule badSeverity = rule("a", "data_freshness");
        badSeverity.setSeverity("urgent");
        MacroIngestProperties.Alerts.Rule badOperator = rule("b", "dq_count");
        badOperator.getCondition().setOperator("<");
        MacroIngestProperties.Alerts.Rule badStatus = rule("c", "ingestion_status");
        badStatus.getCondition().setStatuses(List.of("exploded"));

        for (MacroIngestProperties.Alerts.Rule r : List.of(badSeverity, badOperator, badStatus)) {
            assertThrows(ConfigurationException.class,
                    () -> AlertRulesConfig.buildRules(List.of(r), Clock.systemUTC()), r.getName());
        }
    }

    @Test
    @DisplayName("Duplicate rule names are rejected")
    void testDuplicateNames() {
        assertThrows(ConfigurationException.class, () -> AlertRulesConfig.buildRules(
                List.of(rule("same", "data_freshness"), rule("same", "missing_data")), Clock.systemUTC()));
    }
}
