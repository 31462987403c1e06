package com.macrointel.ingest.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Statistical agencies a series can be fetched from.
 */
public enum DataSource {
    FRED,
    BLS,
    TREASURY,
    CENSUS;

    public static Optional<DataSource> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalised = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.name().equals(normalised))
                .findFirst();
    }
}
