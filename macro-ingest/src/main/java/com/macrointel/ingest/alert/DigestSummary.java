package com.macrointel.ingest.alert;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.macrointel.ingest.model.Severity;

import java.time.LocalDate;
import java.util.List;

public record DigestSummary(LocalDate date,
                            @JsonProperty("critical_count") int criticalCount,
                            @JsonProperty("warning_count") int warningCount,
                            @JsonProperty("info_count") int infoCount,
                            @JsonProperty("total_count") int totalCount) {

    public static DigestSummary of(List<Alert> alerts, LocalDate date) {
        return new DigestSummary(date,
                count(alerts, Severity.CRITICAL),
                count(alerts, Severity.WARNING),
                count(alerts, Severity.INFO),
                alerts.size());
    }

    private static int count(List<Alert> alerts, Severity severity) {
        return (int) alerts.stream().filter(a -> a.getSeverity() == severity).count();
    }
}
