package com.macrointel.ingest.alert;

import com.macrointel.ingest.exception.ConfigurationException;

public enum ComparisonOperator {
    GREATER_OR_EQUAL(">="),
    GREATER(">"),
    EQUAL("=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double actual, double threshold) {
        return switch (this) {
            case GREATER_OR_EQUAL -> actual >= threshold;
            case GREATER -> actual > threshold;
            case EQUAL -> actual == threshold;
        };
    }

    public static ComparisonOperator parse(String raw) {
        String trimmed = raw == null ? ">=" : raw.trim();
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(trimmed)) return operator;
        }
        throw new ConfigurationException("Unknown comparison operator: " + raw);
    }
}
