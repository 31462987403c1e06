package com.macrointel.ingest.service.quality;

import com.macrointel.ingest.model.IngestionMode;
import com.macrointel.ingest.model.SeriesDefinition;
import com.macrointel.ingest.model.SeriesRunStats;
import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs every {@link DataQualityCheck} in order against one finished run.
 * A failing check becomes a warning finding; the remaining checks still run.
 */
@Slf4j
@Service
public class DataQualityValidator {

    public static final String DQ_CHECK_FAILED = "dq_check_failed";

    private final List<DataQualityCheck> checks;
    private final Clock clock;

    public DataQualityValidator(List<DataQualityCheck> checks, Clock clock) {
        this.checks = List.copyOf(checks);
        this.clock = clock;
    }

    public List<ValidationFinding> validate(IngestionMode mode,
                                            List<SeriesDefinition> configuredSeries,
                                            Map<String, SeriesRunStats> seriesStats) {
        ValidationContext context = new ValidationContext(
                mode, configuredSeries, seriesStats, LocalDate.now(clock));

        List<ValidationFinding> findings = new ArrayList<>();
        for (DataQualityCheck check : checks) {
            try {
                List<ValidationFinding> produced = check.check(context);
                findings.addAll(produced);
                log.debug("DQ check {} produced {} finding(s)", check.name(), produced.size());
            } catch (Exception e) {
                log.error("DQ check {} failed: {}", check.name(), e.getMessage(), e);
                findings.add(ValidationFinding.builder()
                        .severity(Severity.WARNING)
                        .code(DQ_CHECK_FAILED)
                        .message("Data quality check '" + check.name() + "' failed: " + e.getMessage())
                        .meta("check", check.name())
                        .build());
            }
        }

        log.info("DQ validation complete: {} finding(s) {}", findings.size(), Findings.countBySeverity(findings));
        return findings;
    }
}
