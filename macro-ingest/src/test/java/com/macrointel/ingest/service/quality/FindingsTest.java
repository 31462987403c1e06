package com.macrointel.ingest.service.quality;

import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FindingsTest {

    private static ValidationFinding finding(Severity severity, String code, String seriesId) {
        return ValidationFinding.builder().severity(severity).code(code).message(code).seriesId(seriesId).build();
    }

    @Test
    void countBySeverity_AlwaysHasAllKeys() {
        assertEquals(Map.of("info", 0, "warning", 0, "critical", 0), Findings.countBySeverity(List.of()));
    }

    @Test
    void countBySeverity_SumsToSize() {
        List<ValidationFinding> findings = List.of(
                finding(Severity.WARNING, "stale_series_data", "A"),
                finding(Severity.WARNING, "stale_series_data", "B"),
                finding(Severity.CRITICAL, "duplicate_observations", "A"),
                finding(Severity.INFO, "note", null));

        Map<String, Integer> counts = Findings.countBySeverity(findings);

        assertEquals(2, counts.get("warning"));
        assertEquals(1, counts.get("critical"));
        assertEquals(1, counts.get("info"));
        assertEquals(findings.size(), counts.values().stream().mapToInt(Integer::intValue).sum());
    }

    @Test
    void summarize_Empty() {
        assertEquals("No findings.", Findings.summarize(List.of()));
    }

    @Test
    void summarize_AnnotatesSeriesAndTruncates() {
        List<ValidationFinding> findings = List.of(
                finding(Severity.WARNING, "incremental_no_new_rows", null),
                finding(Severity.WARNING, "stale_series_data", "A"),
                finding(Severity.WARNING, "stale_series_data", "B"));

        assertEquals("incremental_no_new_rows, stale_series_data(A), +1 more", Findings.summarize(findings, 2));
        assertEquals("incremental_no_new_rows, stale_series_data(A), stale_series_data(B)",
                Findings.summarize(findings));
    }

    @Test
    void seriesWithCodes_DistinctInOrder() {
        List<ValidationFinding> findings = List.of(
                finding(Severity.WARNING, "stale_series_data", "B"),
                finding(Severity.CRITICAL, "missing_series_data", "A"),
                finding(Severity.WARNING, "series_has_no_observations", "A"),
                finding(Severity.WARNING, "incremental_no_new_rows", null));

        assertEquals(List.of("A"),
                Findings.seriesWithCodes(findings, Set.of("missing_series_data", "series_has_no_observations")));
    }
}
