package com.macrointel.ingest.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Locale;

public enum IngestionMode {

    /** Recent window only, wide enough to pick up revisions. */
    INCREMENTAL("incremental"),

    /** Full history. */
    BACKFILL("backfill");

    private final String wireName;

    IngestionMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public LocalDate windowStart(LocalDate today) {
        return switch (this) {
            case INCREMENTAL -> today.minusDays(60);
            case BACKFILL -> today.minusYears(10);
        };
    }

    public static IngestionMode parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("mode must be 'incremental' or 'backfill'");
        }
        String normalised = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.wireName.equals(normalised))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid mode: " + raw + ". Must be 'incremental' or 'backfill'."));
    }
}
