package com.macrointel.ingest.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.macrointel.ingest.config.MacroIngestProperties;
import com.macrointel.ingest.model.ValidationFinding;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Exports one run's DQ findings to CSV.
 *
 * Output path pattern: {outputDir}/dq_findings_{runId}.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FindingsCsvWriter {

    private final MacroIngestProperties properties;
    private final ObjectMapper objectMapper;

    static final String[] HEADERS = {
            "run_id", "severity", "code", "series_id", "message", "metadata"
    };

    public boolean isEnabled() {
        return properties.getOutput().getCsv().isEnabled();
    }

    /**
     * @return the written file
     */
    public Path write(String runId, List<ValidationFinding> findings) {
        MacroIngestProperties.Output.Csv csv = properties.getOutput().getCsv();
        Path outputDir = Paths.get(csv.getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve(String.format("dq_findings_%s.csv", runId));

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (csv.isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (ValidationFinding f : findings) {
                writer.writeNext(toRow(runId, f));
            }

            log.info("Written {} findings to CSV: {}", findings.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write findings CSV " + outputPath, e);
        }
    }

    private String[] toRow(String runId, ValidationFinding f) {
        return new String[]{
                runId,
                f.getSeverity().wireName(),
                f.getCode(),
                str(f.getSeriesId()),
                str(f.getMessage()),
                metadataJson(f)
        };
    }

    private String metadataJson(ValidationFinding f) {
        try {
            return objectMapper.writeValueAsString(f.getMetadata());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialise finding metadata", e);
        }
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
