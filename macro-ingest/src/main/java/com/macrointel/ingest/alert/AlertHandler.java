package com.macrointel.ingest.alert;

import java.util.List;

/**
 * Delivery channel for alerts. A disabled handler reports success without doing anything;
 * a handler that cannot deliver returns false rather than throwing.
 */
public interface AlertHandler {

    String name();

    boolean isEnabled();

    boolean sendAlert(Alert alert);

    boolean sendDigest(List<Alert> alerts, DigestSummary summary);
}
