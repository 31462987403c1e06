package com.macrointel.ingest.service.quality;

import com.macrointel.ingest.model.IngestionMode;
import com.macrointel.ingest.model.SeriesDefinition;
import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Backfill: every series must have fetched at least one row.
 * Incremental: a quiet series is normal, only an entirely empty run is flagged.
 */
@Component
@Order(1)
public class MissingDataCheck implements DataQualityCheck {

    public static final String MISSING_SERIES_DATA = "missing_series_data";
    public static final String INCREMENTAL_NO_NEW_ROWS = "incremental_no_new_rows";

    @Override
    public String name() {
        return "missing_required_data";
    }

    @Override
    public List<ValidationFinding> check(ValidationContext context) {
        List<ValidationFinding> findings = new ArrayList<>();

        if (context.mode() == IngestionMode.BACKFILL) {
            for (SeriesDefinition series : context.configuredSeries()) {
                int fetched = context.rowsFetched(series.getSeriesId());
                if (fetched == 0) {
                    findings.add(ValidationFinding.builder()
                            .severity(Severity.CRITICAL)
                            .code(MISSING_SERIES_DATA)
                            .message("No rows fetched during backfill for required series.")
                            .seriesId(series.getSeriesId())
                            .meta("mode", context.mode().wireName())
                            .meta("rows_fetched", fetched)
                            .build());
                }
            }
            return findings;
        }

        int totalFetched = context.configuredSeries().stream()
                .mapToInt(s -> context.rowsFetched(s.getSeriesId()))
                .sum();
        if (totalFetched == 0) {
            findings.add(ValidationFinding.builder()
                    .severity(Severity.WARNING)
                    .code(INCREMENTAL_NO_NEW_ROWS)
                    .message("Incremental run fetched no rows for all configured series.")
                    .meta("mode", context.mode().wireName())
                    .meta("total_fetched", totalFetched)
                    .build());
        }
        return findings;
    }
}
