package com.macrointel.ingest.service.quality;

import com.macrointel.ingest.model.Frequency;
import com.macrointel.ingest.model.SeriesDefinition;
import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;
import com.macrointel.ingest.output.ObservationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Latest stored observation must be younger than the series' frequency allows.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class FreshnessCheck implements DataQualityCheck {

    public static final String SERIES_HAS_NO_OBSERVATIONS = "series_has_no_observations";
    public static final String STALE_SERIES_DATA = "stale_series_data";

    private final ObservationRepository observationRepository;

    @Override
    public String name() {
        return "freshness";
    }

    @Override
    public List<ValidationFinding> check(ValidationContext context) {
        List<ValidationFinding> findings = new ArrayList<>();

        for (SeriesDefinition series : context.configuredSeries()) {
            Optional<LocalDate> latest = observationRepository.latestObservationDate(series.getSeriesId());
            if (latest.isEmpty()) {
                findings.add(ValidationFinding.builder()
                        .severity(Severity.WARNING)
                        .code(SERIES_HAS_NO_OBSERVATIONS)
                        .message("Series has no observations in the database.")
                        .seriesId(series.getSeriesId())
                        .meta("frequency", String.valueOf(series.getFrequency()))
                        .build());
                continue;
            }

            long ageDays = ChronoUnit.DAYS.between(latest.get(), context.today());
            Frequency frequency = series.frequencyBucket();
            int threshold = frequency.getStalenessDays();
            if (ageDays > threshold) {
                findings.add(ValidationFinding.builder()
                        .severity(Severity.WARNING)
                        .code(STALE_SERIES_DATA)
                        .message("Latest observation is " + ageDays + " days old (threshold " + threshold + ").")
                        .seriesId(series.getSeriesId())
                        .meta("age_days", ageDays)
                        .meta("threshold_days", threshold)
                        .meta("frequency", String.valueOf(series.getFrequency()))
                        .build());
            }
        }
        return findings;
    }
}
