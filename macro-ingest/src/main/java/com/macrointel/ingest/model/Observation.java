package com.macrointel.ingest.model;

import java.time.LocalDate;

/**
 * Stored fact keyed by (seriesId, observationDate). A later write for the same key
 * replaces the value.
 */
public record Observation(String seriesId, LocalDate observationDate, Double value) {}
