package com.macrointel.ingest.client;

import com.macrointel.ingest.config.MacroIngestProperties;
import com.macrointel.ingest.exception.PermanentFetchException;
import com.macrointel.ingest.model.DataPoint;
import com.macrointel.ingest.model.DataSource;
import com.macrointel.ingest.model.FredObservationsResponse;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Client for the St. Louis Fed FRED API.
 *
 * Requires an API key (FRED_API_KEY). Calls are paced by
 * {@code macro-ingest.sources.fred.min-interval-ms}; transient failures are retried by the
 * {@code fred} Resilience4j instance.
 */
@Service
@Slf4j
public class FredClient implements SeriesFetchClient {

    private final RestTemplate restTemplate;
    private final MacroIngestProperties.Sources.Provider config;
    private final RequestPacer pacer;

    public FredClient(RestTemplate restTemplate, MacroIngestProperties properties) {
        this.restTemplate = restTemplate;
        this.config = properties.getSources().getFred();
        this.pacer = new RequestPacer(config.getMinIntervalMs());
    }

    @Override
    public DataSource source() {
        return DataSource.FRED;
    }

    @Override
    @Retry(name = "fred")
    public List<DataPoint> fetch(String requestSeriesId, LocalDate start, LocalDate end) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new PermanentFetchException("FRED " + requestSeriesId + ": no API key configured (FRED_API_KEY)");
        }

        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(config.getBaseUrl() + "/series/observations")
                .queryParam("series_id", requestSeriesId)
                .queryParam("api_key", config.getApiKey())
                .queryParam("file_type", "json");
        if (start != null) builder.queryParam("observation_start", start);
        if (end != null) builder.queryParam("observation_end", end);
        URI uri = builder.build().encode().toUri();

        log.debug("Fetching FRED series {} from {} to {}", requestSeriesId, start, end);
        pacer.await();

        FredObservationsResponse response;
        try {
            response = restTemplate.getForObject(uri, FredObservationsResponse.class);
        } catch (RestClientException e) {
            throw ProviderErrors.translate("FRED", requestSeriesId, e);
        }

        if (response == null || response.getObservations() == null) {
            return List.of();
        }

        List<DataPoint> points = new ArrayList<>();
        for (FredObservationsResponse.Observation o : response.getObservations()) {
            if (o.getDate() == null) continue;
            try {
                points.add(new DataPoint(LocalDate.parse(o.getDate()), ProviderErrors.parseValue(o.getValue())));
            } catch (DateTimeParseException e) {
                log.warn("Skipping FRED observation with bad date '{}' for {}", o.getDate(), requestSeriesId);
            }
        }
        points.sort(Comparator.comparing(DataPoint::date));

        log.info("Fetched {} observations for FRED series {}", points.size(), requestSeriesId);
        return points;
    }
}
