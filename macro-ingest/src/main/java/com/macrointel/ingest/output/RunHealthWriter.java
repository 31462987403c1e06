package com.macrointel.ingest.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.macrointel.ingest.config.MacroIngestProperties;
import com.macrointel.ingest.model.RunHealthSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes the latest run's health summary as pretty-printed JSON for automation to pick up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunHealthWriter {

    private final MacroIngestProperties properties;
    private final ObjectMapper objectMapper;

    public Path write(RunHealthSummary summary) {
        Path target = Paths.get(properties.getOutput().getHealthJsonPath());
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), summary);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run health JSON " + target, e);
        }
        log.info("Run health written to {}", target);
        return target;
    }
}
