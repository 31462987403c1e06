package com.macrointel.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO for FRED's /series/observations JSON.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FredObservationsResponse {

    private List<Observation> observations = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Observation {
        private String date;
        /** Decimal string, or "." when FRED has no value for the period. */
        private String value;
    }
}
