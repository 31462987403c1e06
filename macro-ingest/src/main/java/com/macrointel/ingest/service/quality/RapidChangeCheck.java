package com.macrointel.ingest.service.quality;

import com.macrointel.ingest.model.SeriesDefinition;
import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;
import com.macrointel.ingest.output.ObservationRepository;
import com.macrointel.ingest.output.ObservationRepository.LatestPair;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags a latest-period move of more than 100% against the previous observation.
 * Previous values under 0.1 in magnitude are skipped: tiny bases turn noise into huge percentages.
 */
@Component
@Order(4)
@RequiredArgsConstructor
public class RapidChangeCheck implements DataQualityCheck {

    public static final String RAPID_CHANGE_DETECTED = "rapid_change_detected";

    static final double MIN_BASE_MAGNITUDE = 0.1;
    static final double MAX_PCT_CHANGE = 100.0;

    private final ObservationRepository observationRepository;

    @Override
    public String name() {
        return "rapid_change";
    }

    @Override
    public List<ValidationFinding> check(ValidationContext context) {
        List<ValidationFinding> findings = new ArrayList<>();

        for (SeriesDefinition series : context.configuredSeries()) {
            Optional<LatestPair> pair = observationRepository.latestTwo(series.getSeriesId());
            if (pair.isEmpty() || pair.get().previous() == null) continue;

            Double latest = pair.get().latest().value();
            Double previous = pair.get().previous().value();
            if (latest == null || previous == null) continue;
            if (Math.abs(previous) < MIN_BASE_MAGNITUDE) continue;

            double pctChange = Math.abs((latest - previous) / Math.abs(previous)) * 100.0;
            if (pctChange > MAX_PCT_CHANGE) {
                findings.add(ValidationFinding.builder()
                        .severity(Severity.WARNING)
                        .code(RAPID_CHANGE_DETECTED)
                        .message(String.format(Locale.ROOT, "Large latest-period change detected (%.2f%%).", pctChange))
                        .seriesId(series.getSeriesId())
                        .meta("pct_change", BigDecimal.valueOf(pctChange).setScale(4, RoundingMode.HALF_UP).doubleValue())
                        .build());
            }
        }
        return findings;
    }
}
