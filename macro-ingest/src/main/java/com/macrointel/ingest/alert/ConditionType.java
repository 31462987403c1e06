package com.macrointel.ingest.alert;

import com.macrointel.ingest.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

public enum ConditionType {
    INGESTION_STATUS,
    DQ_COUNT,
    DATA_FRESHNESS,
    MISSING_DATA,
    ERROR_RATE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConditionType parse(String raw) {
        String normalised = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.name().equals(normalised))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unknown alert condition type: " + raw));
    }
}
