package com.macrointel.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO for the BLS Public Data API v2 timeseries response.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlsResponse {

    /** REQUEST_SUCCEEDED, REQUEST_NOT_PROCESSED or REQUEST_FAILED. */
    private String status;

    private List<String> message = new ArrayList<>();

    @JsonProperty("Results")
    private Results results;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Results {
        private List<Series> series = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Series {
        @JsonProperty("seriesID")
        private String seriesId;
        private List<Point> data = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Point {
        private String year;
        /** M01-M12, M13 (annual average), Q01-Q04 or A01. */
        private String period;
        private String value;
    }
}
