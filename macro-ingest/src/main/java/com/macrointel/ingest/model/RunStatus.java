package com.macrointel.ingest.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Terminal status of an ingestion run, ordered from best to worst.
 */
public enum RunStatus {
    SUCCESS,
    PARTIAL,
    FAILED;

    /**
     * Returns the worse of this status and {@code other}. Status only ever moves
     * towards FAILED within a run.
     */
    public RunStatus escalate(RunStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus parse(String raw) {
        String normalised = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.name().equals(normalised))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown run status: " + raw));
    }
}
