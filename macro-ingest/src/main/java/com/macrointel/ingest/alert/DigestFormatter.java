package com.macrointel.ingest.alert;

import com.macrointel.ingest.model.Severity;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders single alerts and digests as plain text and HTML. Digests are grouped
 * critical, warning, info, each group capped with an overflow line.
 */
@Component
public class DigestFormatter {

    static final Map<Severity, Integer> PREVIEW_LIMITS = Map.of(
            Severity.CRITICAL, 10,
            Severity.WARNING, 10,
            Severity.INFO, 5);

    private static final List<Severity> GROUP_ORDER =
            List.of(Severity.CRITICAL, Severity.WARNING, Severity.INFO);

    private static final String RULE = "=".repeat(60);

    private static final Map<Severity, String> COLOURS = Map.of(
            Severity.CRITICAL, "#dc3545",
            Severity.WARNING, "#ffc107",
            Severity.INFO, "#17a2b8");

    public String formatAlert(Alert alert) {
        return String.join("\n",
                "[" + label(alert) + "] " + alert.getRuleName(),
                "  Description: " + orNa(alert.getDescription()),
                "  Timestamp: " + alert.getTimestamp(),
                "  Details: " + orNa(alert.getDetails()));
    }

    public String formatDigest(List<Alert> alerts, DigestSummary summary) {
        StringBuilder out = new StringBuilder()
                .append("Macro Ingest - Daily Alert Digest\n")
                .append("Date: ").append(summary.date()).append("\n\n")
                .append("Summary:\n")
                .append("  Critical: ").append(summary.criticalCount()).append('\n')
                .append("  Warning: ").append(summary.warningCount()).append('\n')
                .append("  Info: ").append(summary.infoCount()).append('\n')
                .append("  Total: ").append(summary.totalCount()).append("\n\n")
                .append(RULE).append('\n');

        for (Severity severity : GROUP_ORDER) {
            List<Alert> group = ofSeverity(alerts, severity);
            if (group.isEmpty()) continue;

            int limit = PREVIEW_LIMITS.get(severity);
            out.append('\n').append(capitalise(severity)).append(" Alerts\n\n");
            group.stream().limit(limit).forEach(a -> out.append(formatAlert(a)).append("\n\n"));
            if (group.size() > limit) {
                out.append(overflowLine(group.size() - limit, severity)).append('\n');
            }
        }

        return out.append(RULE).append('\n')
                .append("Macro Ingest - Automated Alert System")
                .toString();
    }

    public String formatAlertHtml(Alert alert) {
        String colour = COLOURS.getOrDefault(alert.getSeverity(), "#6c757d");
        return "<div style=\"margin: 10px 0; padding: 15px; border-left: 4px solid " + colour + ";\">"
                + "<h3 style=\"margin: 0 0 10px 0; color: " + colour + ";\">["
                + label(alert) + "] " + escape(alert.getRuleName()) + "</h3>"
                + "<p><strong>Description:</strong> " + escape(orNa(alert.getDescription())) + "</p>"
                + "<p><strong>Timestamp:</strong> " + alert.getTimestamp() + "</p>"
                + "<p><strong>Details:</strong> " + escape(orNa(alert.getDetails())) + "</p>"
                + "</div>";
    }

    public String formatDigestHtml(List<Alert> alerts, DigestSummary summary) {
        StringBuilder html = new StringBuilder()
                .append("<!DOCTYPE html><html><head><meta charset=\"UTF-8\"></head><body>")
                .append("<h1>Macro Ingest - Daily Alert Digest</h1>")
                .append("<p>").append(summary.date()).append("</p>")
                .append("<h2>Summary</h2><ul>")
                .append("<li>Critical: ").append(summary.criticalCount()).append("</li>")
                .append("<li>Warning: ").append(summary.warningCount()).append("</li>")
                .append("<li>Info: ").append(summary.infoCount()).append("</li>")
                .append("<li>Total: ").append(summary.totalCount()).append("</li></ul>");

        for (Severity severity : GROUP_ORDER) {
            List<Alert> group = ofSeverity(alerts, severity);
            if (group.isEmpty()) continue;

            int limit = PREVIEW_LIMITS.get(severity);
            html.append("<h2>").append(capitalise(severity)).append(" Alerts</h2>");
            group.stream().limit(limit).forEach(a -> html.append(formatAlertHtml(a)));
            if (group.size() > limit) {
                html.append("<p><em>").append(overflowLine(group.size() - limit, severity)).append("</em></p>");
            }
        }

        return html.append("</body></html>").toString();
    }

    static String overflowLine(int hidden, Severity severity) {
        return "... and " + hidden + " more " + severity.wireName() + " alerts";
    }

    private static List<Alert> ofSeverity(List<Alert> alerts, Severity severity) {
        return alerts.stream().filter(a -> a.getSeverity() == severity).toList();
    }

    private static String label(Alert alert) {
        return alert.getSeverity() == null ? "INFO" : alert.getSeverity().name();
    }

    private static String capitalise(Severity severity) {
        String name = severity.wireName();
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
