package com.macrointel.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Raw DTO matching one entry of the series catalog YAML.
 * Kept separate from {@link SeriesDefinition} so file-format coupling stays here.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogEntry {

    @NotBlank
    @JsonProperty("series_id")
    private String seriesId;

    @NotBlank
    private String title;

    @NotBlank
    private String units;

    @NotBlank
    private String frequency;

    @NotBlank
    @JsonProperty("seasonal_adjustment")
    private String seasonalAdjustment;

    @NotNull
    @Min(1)
    private Integer tier;

    private String source = "FRED";

    @JsonProperty("source_series_id")
    private String sourceSeriesId;

    @JsonProperty("fallback_series_id")
    private String fallbackSeriesId;

    private String description = "";
}
