package com.macrointel.ingest.alert;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingAlertHandler implements AlertHandler {

    private final DigestFormatter formatter;

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public boolean sendAlert(Alert alert) {
        log.warn("ALERT {}", formatter.formatAlert(alert));
        return true;
    }

    @Override
    public boolean sendDigest(List<Alert> alerts, DigestSummary summary) {
        log.info("ALERT DIGEST\n{}", formatter.formatDigest(alerts, summary));
        return true;
    }
}
