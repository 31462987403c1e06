package com.macrointel.ingest.alert;

import com.macrointel.ingest.config.MacroIngestProperties.Alerts.DispatchMode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates every rule against a run context and routes the resulting alerts,
 * either straight to the handlers or into a buffer flushed by {@link #sendDigest()}.
 *
 * Rule cooldowns and the buffer are engine state; calls are serialised on the engine.
 */
@Slf4j
public class AlertEngine {

    private final List<AlertRule> rules;
    private final List<AlertHandler> handlers;
    private final DispatchMode dispatchMode;
    private final Clock clock;

    private final List<Alert> buffer = new ArrayList<>();

    public AlertEngine(List<AlertRule> rules, List<AlertHandler> handlers, DispatchMode dispatchMode, Clock clock) {
        this.rules = List.copyOf(rules);
        this.handlers = List.copyOf(handlers);
        this.dispatchMode = dispatchMode;
        this.clock = clock;
    }

    public synchronized List<Alert> evaluateAll(AlertContext context) {
        List<Alert> triggered = new ArrayList<>();
        for (AlertRule rule : rules) {
            try {
                rule.evaluate(context).ifPresent(alert -> {
                    triggered.add(alert);
                    log.info("Alert triggered: {} ({})", rule.getName(), alert.getSeverity().wireName());
                });
            } catch (Exception e) {
                log.error("Error evaluating rule {}: {}", rule.getName(), e.getMessage(), e);
            }
        }
        return triggered;
    }

    public synchronized List<Alert> checkAndAlert(AlertContext context) {
        List<Alert> alerts = evaluateAll(context);
        alerts.forEach(this::dispatch);
        return alerts;
    }

    public synchronized void dispatch(Alert alert) {
        if (dispatchMode == DispatchMode.DIGEST) {
            buffer.add(alert);
            log.debug("Alert buffered for digest: {}", alert.getRuleName());
            return;
        }
        for (AlertHandler handler : handlers) {
            try {
                if (!handler.sendAlert(alert)) {
                    log.warn("Handler {} did not deliver alert {}", handler.name(), alert.getRuleName());
                }
            } catch (Exception e) {
                log.error("Handler {} failed to send alert: {}", handler.name(), e.getMessage(), e);
            }
        }
    }

    /**
     * Sends one digest of the buffered alerts through every handler and empties the buffer.
     *
     * @return the digest summary, or empty when nothing was buffered
     */
    public synchronized Optional<DigestSummary> sendDigest() {
        if (buffer.isEmpty()) {
            log.debug("No alerts to send in digest");
            return Optional.empty();
        }

        List<Alert> alerts = List.copyOf(buffer);
        DigestSummary summary = DigestSummary.of(alerts, LocalDate.now(clock));
        for (AlertHandler handler : handlers) {
            try {
                if (!handler.sendDigest(alerts, summary)) {
                    log.warn("Handler {} did not deliver the digest", handler.name());
                }
            } catch (Exception e) {
                log.error("Handler {} failed to send digest: {}", handler.name(), e.getMessage(), e);
            }
        }

        buffer.clear();
        log.info("Digest sent with {} alerts", alerts.size());
        return Optional.of(summary);
    }

    public synchronized List<Alert> getBufferedAlerts() {
        return List.copyOf(buffer);
    }

    public synchronized void clearBuffer() {
        buffer.clear();
    }

    public List<AlertRule> getRules() {
        return rules;
    }

    public DispatchMode getDispatchMode() {
        return dispatchMode;
    }
}
