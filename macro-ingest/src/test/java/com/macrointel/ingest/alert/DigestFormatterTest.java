package com.macrointel.ingest.alert;

import com.macrointel.ingest.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DigestFormatterTest {

    private final DigestFormatter formatter = new DigestFormatter();

    private static List<Alert> alerts(Severity severity, int count) {
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            alerts.add(Alert.builder()
                    .ruleName(severity.wireName() + "_" + i)
                    .severity(severity)
                    .description("desc")
                    .timestamp(LocalDateTime.of(2024, 3, 1, 8, 0))
                    .details("details " + i)
                    .metadata(Map.of())
                    .build());
        }
        return alerts;
    }

    @Test
    void formatDigest_CapsEachGroup() {
        List<Alert> all = new ArrayList<>();
        all.addAll(alerts(Severity.INFO, 7));
        all.addAll(alerts(Severity.CRITICAL, 12));
        all.addAll(alerts(Severity.WARNING, 3));
        DigestSummary summary = DigestSummary.of(all, LocalDate.of(2024, 3, 1));

        String text = formatter.formatDigest(all, summary);

        assertTrue(text.contains("... and 2 more critical alerts"));
        assertTrue(text.contains("... and 2 more info alerts"));
        assertFalse(text.contains("more warning alerts"));
        assertTrue(text.contains("critical_9"));
        assertFalse(text.contains("critical_10"));
        assertTrue(text.indexOf("Critical Alerts") < text.indexOf("Warning Alerts"));
        assertTrue(text.indexOf("Warning Alerts") < text.indexOf("Info Alerts"));
        assertTrue(text.contains("Total: 22"));
    }

    @Test
    void formatDigestHtml_EscapesAndCaps() {
        List<Alert> all = new ArrayList<>(alerts(Severity.INFO, 6));
        all.add(Alert.builder().ruleName("<script>").severity(Severity.WARNING)
                .timestamp(LocalDateTime.of(2024, 3, 1, 8, 0)).details("a & b").metadata(Map.of()).build());

        String html = formatter.formatDigestHtml(all, DigestSummary.of(all, LocalDate.of(2024, 3, 1)));

        assertTrue(html.contains("&lt;script&gt;"));
        assertTrue(html.contains("a &amp; b"));
        assertTrue(html.contains("... and 1 more info alerts"));
    }

    @Test
    void formatAlert_UsesNaForBlankFields() {
        Alert alert = Alert.builder().ruleName("r").severity(Severity.CRITICAL)
                .timestamp(LocalDateTime.of(2024, 3, 1, 8, 0)).metadata(Map.of()).build();

        String text = formatter.formatAlert(alert);

        assertTrue(text.startsWith("[CRITICAL] r"));
        assertTrue(text.contains("Description: N/A"));
    }
}
