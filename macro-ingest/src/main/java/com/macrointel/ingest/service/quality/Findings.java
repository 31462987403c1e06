package com.macrointel.ingest.service.quality;

import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only views over a finding list.
 */
public final class Findings {

    public static final int DEFAULT_SUMMARY_ITEMS = 5;

    private Findings() {
    }

    /** Counts keyed by severity wire name; every severity is present. */
    public static Map<String, Integer> countBySeverity(List<ValidationFinding> findings) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            counts.put(severity.wireName(), 0);
        }
        for (ValidationFinding finding : findings) {
            counts.merge(finding.getSeverity().wireName(), 1, Integer::sum);
        }
        return counts;
    }

    public static long count(List<ValidationFinding> findings, Severity severity) {
        return findings.stream().filter(f -> f.getSeverity() == severity).count();
    }

    public static List<ValidationFinding> ofSeverity(List<ValidationFinding> findings, Severity severity) {
        return findings.stream().filter(f -> f.getSeverity() == severity).toList();
    }

    /** Distinct series ids of findings carrying any of the given codes, in finding order. */
    public static List<String> seriesWithCodes(List<ValidationFinding> findings, Set<String> codes) {
        return findings.stream()
                .filter(f -> codes.contains(f.getCode()))
                .map(ValidationFinding::getSeriesId)
                .filter(id -> id != null)
                .distinct()
                .toList();
    }

    public static String summarize(List<ValidationFinding> findings) {
        return summarize(findings, DEFAULT_SUMMARY_ITEMS);
    }

    /**
     * {@code "code(series), code, +N more"}, or {@code "No findings."} for an empty list.
     */
    public static String summarize(List<ValidationFinding> findings, int maxItems) {
        if (findings.isEmpty()) return "No findings.";

        String head = findings.stream()
                .limit(maxItems)
                .map(f -> f.getSeriesId() == null ? f.getCode() : f.getCode() + "(" + f.getSeriesId() + ")")
                .collect(Collectors.joining(", "));
        int remaining = findings.size() - maxItems;
        return remaining > 0 ? head + ", +" + remaining + " more" : head;
    }
}
