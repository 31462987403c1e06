package com.macrointel.ingest.model;

import java.util.Locale;

/**
 * Observation cadence of a series, with the age (in days) after which its
 * latest observation counts as stale.
 */
public enum Frequency {
    DAILY(10),
    WEEKLY(28),
    MONTHLY(90),
    QUARTERLY(200),
    ANNUAL(550),
    UNKNOWN(180);

    private final int stalenessDays;

    Frequency(int stalenessDays) {
        this.stalenessDays = stalenessDays;
    }

    public int getStalenessDays() {
        return stalenessDays;
    }

    /**
     * Catalog frequencies are free text ("Monthly", "Daily, Close", "Quarterly").
     * Only the first letter is significant.
     */
    public static Frequency parse(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        return switch (raw.trim().toLowerCase(Locale.ROOT).charAt(0)) {
            case 'd' -> DAILY;
            case 'w' -> WEEKLY;
            case 'm' -> MONTHLY;
            case 'q' -> QUARTERLY;
            case 'a' -> ANNUAL;
            default -> UNKNOWN;
        };
    }
}
