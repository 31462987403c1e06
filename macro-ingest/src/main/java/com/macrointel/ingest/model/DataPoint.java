package com.macrointel.ingest.model;

import java.time.LocalDate;

/**
 * A single (date, value) pair as returned by a provider. {@code value} is null when
 * the provider publishes a placeholder for a missing observation.
 */
public record DataPoint(LocalDate date, Double value) {}
