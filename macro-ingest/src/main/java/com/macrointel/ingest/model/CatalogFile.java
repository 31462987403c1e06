package com.macrointel.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogFile {

    private List<CatalogEntry> series = new ArrayList<>();
}
