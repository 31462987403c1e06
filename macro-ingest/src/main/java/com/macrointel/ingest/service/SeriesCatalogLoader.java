package com.macrointel.ingest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.macrointel.ingest.exception.ConfigurationException;
import com.macrointel.ingest.model.CatalogEntry;
import com.macrointel.ingest.model.CatalogFile;
import com.macrointel.ingest.model.DataSource;
import com.macrointel.ingest.model.SeriesDefinition;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the series catalog YAML and turns it into validated {@link SeriesDefinition}s.
 *
 * Expected layout:
 * <pre>
 * series:
 *   - series_id: FEDFUNDS
 *     title: Federal Funds Effective Rate
 *     units: Percent
 *     frequency: Monthly
 *     seasonal_adjustment: NSA
 *     tier: 1
 *     source: FRED
 * </pre>
 *
 * Every problem in the file is collected before failing, so one bad deploy shows all of them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SeriesCatalogLoader {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final Validator validator;
    private final ResourceLoader resourceLoader = new DefaultResourceLoader();

    public List<SeriesDefinition> load(String location) {
        Resource resource = resolve(location);
        if (!resource.exists()) {
            throw new ConfigurationException("Catalog not found at " + location);
        }

        CatalogFile file;
        try (InputStream in = resource.getInputStream()) {
            file = YAML.readValue(in, CatalogFile.class);
        } catch (IOException e) {
            throw new ConfigurationException("Catalog at " + location + " is not valid YAML: " + e.getMessage(), e);
        }
        if (file == null || file.getSeries() == null) {
            throw new ConfigurationException("Catalog at " + location + " has no 'series' list");
        }

        List<String> problems = new ArrayList<>();
        List<SeriesDefinition> definitions = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < file.getSeries().size(); i++) {
            CatalogEntry entry = file.getSeries().get(i);
            if (entry == null) {
                problems.add("entry #" + i + ": empty entry");
                continue;
            }
            String label = entry.getSeriesId() != null ? entry.getSeriesId() : "entry #" + i;

            for (ConstraintViolation<CatalogEntry> v : validator.validate(entry)) {
                problems.add(label + ": " + v.getPropertyPath() + " " + v.getMessage());
            }

            DataSource source = DataSource.parse(entry.getSource()).orElse(null);
            if (source == null) {
                problems.add(label + ": source must be one of " + List.of(DataSource.values())
                        + " but was '" + entry.getSource() + "'");
            }

            if (entry.getSeriesId() != null && !seen.add(entry.getSeriesId())) {
                problems.add(label + ": duplicate series_id");
            }

            if (source != null && problems.isEmpty()) {
                definitions.add(toDefinition(entry, source));
            }
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid series catalog " + location + ": " + String.join("; ", problems));
        }

        log.info("Loaded {} series from catalog {}", definitions.size(), location);
        return List.copyOf(definitions);
    }

    private SeriesDefinition toDefinition(CatalogEntry entry, DataSource source) {
        String sourceSeriesId = blankToNull(entry.getSourceSeriesId());
        if (sourceSeriesId == null) sourceSeriesId = entry.getSeriesId();
        String fallbackSeriesId = blankToNull(entry.getFallbackSeriesId());
        if (fallbackSeriesId == null) fallbackSeriesId = sourceSeriesId;

        return SeriesDefinition.builder()
                .seriesId(entry.getSeriesId())
                .source(source)
                .sourceSeriesId(sourceSeriesId)
                .fallbackSeriesId(fallbackSeriesId)
                .frequency(entry.getFrequency())
                .tier(entry.getTier())
                .title(entry.getTitle())
                .units(entry.getUnits())
                .seasonalAdjustment(entry.getSeasonalAdjustment())
                .description(entry.getDescription())
                .build();
    }

    private Resource resolve(String location) {
        if (location == null || location.isBlank()) {
            throw new ConfigurationException("Catalog path is not configured");
        }
        if (location.startsWith("classpath:") || location.startsWith("file:")) {
            return resourceLoader.getResource(location);
        }
        return resourceLoader.getResource("file:" + location);
    }

    private String blankToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }
}
