package com.macrointel.ingest.client;

import com.macrointel.ingest.model.DataSource;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps each {@link DataSource} to the one long-lived client instance serving it.
 *
 * Clients keep provider rate-limit state between calls, so there is exactly one per source
 * for the life of the router. The router is injected wherever clients are needed rather than
 * being reached through a static accessor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceRouter {

    private final List<SeriesFetchClient> clients;

    private Map<DataSource, SeriesFetchClient> clientsBySource = Collections.emptyMap();

    @PostConstruct
    void initialize() {
        if (clients == null || clients.isEmpty()) {
            log.warn("No SeriesFetchClient beans found. Every fetch will fail.");
            return;
        }

        Map<DataSource, List<SeriesFetchClient>> grouped = clients.stream()
                .collect(Collectors.groupingBy(SeriesFetchClient::source));

        String duplicates = grouped.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> e.getKey() + " -> " + e.getValue().stream()
                        .map(c -> c.getClass().getSimpleName()).toList())
                .collect(Collectors.joining("; "));
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate SeriesFetchClient registrations: " + duplicates);
        }

        Map<DataSource, SeriesFetchClient> map = new EnumMap<>(DataSource.class);
        grouped.forEach((source, list) -> map.put(source, list.get(0)));
        clientsBySource = Collections.unmodifiableMap(map);

        log.info("Registered fetch clients for sources: {}", clientsBySource.keySet());
    }

    /**
     * @throws IllegalArgumentException when no client serves {@code source}
     */
    public SeriesFetchClient clientFor(DataSource source) {
        if (source == null) {
            throw new IllegalArgumentException("Source cannot be null");
        }
        SeriesFetchClient client = clientsBySource.get(source);
        if (client == null) {
            throw new IllegalArgumentException(String.format(
                    "No fetch client registered for source %s. Available sources: %s",
                    source, clientsBySource.keySet()));
        }
        return client;
    }

    public boolean hasClient(DataSource source) {
        return source != null && clientsBySource.containsKey(source);
    }

    public Set<DataSource> getRegisteredSources() {
        return clientsBySource.keySet();
    }
}
