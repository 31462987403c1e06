package com.macrointel.ingest.client;

import com.macrointel.ingest.config.MacroIngestProperties;
import com.macrointel.ingest.exception.PermanentFetchException;
import com.macrointel.ingest.exception.QuotaExhaustedException;
import com.macrointel.ingest.model.BlsResponse;
import com.macrointel.ingest.model.DataPoint;
import com.macrointel.ingest.model.DataSource;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Client for the Bureau of Labor Statistics Public Data API v2.
 *
 * An API key (BLS_API_KEY) is optional but raises the daily query allowance. When the
 * allowance is spent BLS answers REQUEST_NOT_PROCESSED with a "daily threshold" message;
 * that is reported as {@link QuotaExhaustedException} so the caller can switch providers
 * without having to read the text itself.
 *
 * Reference: https://www.bls.gov/developers/api_signature_v2.htm
 */
@Service
@Slf4j
public class BlsClient implements SeriesFetchClient {

    static final String STATUS_SUCCEEDED = "REQUEST_SUCCEEDED";

    private final RestTemplate restTemplate;
    private final MacroIngestProperties.Sources.Provider config;
    private final RequestPacer pacer;

    public BlsClient(RestTemplate restTemplate, MacroIngestProperties properties) {
        this.restTemplate = restTemplate;
        this.config = properties.getSources().getBls();
        this.pacer = new RequestPacer(config.getMinIntervalMs());
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("BLS client has no API key (unregistered limits apply)");
        }
    }

    @Override
    public DataSource source() {
        return DataSource.BLS;
    }

    @Override
    @Retry(name = "bls")
    public List<DataPoint> fetch(String requestSeriesId, LocalDate start, LocalDate end) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("seriesid", List.of(requestSeriesId));
        if (start != null) {
            payload.put("startyear", String.valueOf(start.getYear()));
            payload.put("endyear", String.valueOf((end != null ? end : LocalDate.now()).getYear()));
        }
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            payload.put("registrationkey", config.getApiKey());
        }

        log.debug("Fetching BLS series {} from {} to {}", requestSeriesId, start, end);
        pacer.await();

        BlsResponse response;
        try {
            response = restTemplate.postForObject(config.getBaseUrl(), payload, BlsResponse.class);
        } catch (RestClientException e) {
            throw ProviderErrors.translate("BLS", requestSeriesId, e);
        }
        if (response == null) {
            throw new PermanentFetchException("BLS " + requestSeriesId + ": empty response body");
        }

        if (!STATUS_SUCCEEDED.equals(response.getStatus())) {
            String message = response.getMessage() == null || response.getMessage().isEmpty()
                    ? "Unknown error"
                    : String.join(" ", response.getMessage());
            if (isDailyQuotaMessage(message)) {
                throw new QuotaExhaustedException("BLS " + requestSeriesId + ": daily quota exhausted: " + message);
            }
            throw new PermanentFetchException("BLS " + requestSeriesId + ": request failed: " + message);
        }

        List<BlsResponse.Series> series = response.getResults() == null ? null : response.getResults().getSeries();
        if (series == null || series.isEmpty() || series.get(0) == null || series.get(0).getData() == null) {
            log.warn("No data found for BLS series {}", requestSeriesId);
            return List.of();
        }

        List<DataPoint> points = new ArrayList<>();
        for (BlsResponse.Point p : series.get(0).getData()) {
            LocalDate date = periodToDate(p.getYear(), p.getPeriod());
            if (date == null) {
                log.debug("Skipping BLS observation with unsupported period {} {} for {}",
                        p.getYear(), p.getPeriod(), requestSeriesId);
                continue;
            }
            if (start != null && date.isBefore(start)) continue;
            if (end != null && date.isAfter(end)) continue;
            points.add(new DataPoint(date, ProviderErrors.parseValue(p.getValue())));
        }
        // BLS returns newest first
        points.sort(Comparator.comparing(DataPoint::date));

        log.info("Fetched {} observations for BLS series {}", points.size(), requestSeriesId);
        return points;
    }

    static boolean isDailyQuotaMessage(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("daily threshold") || lower.contains("threshold for daily");
    }

    /**
     * M01-M12 map to the first day of the month, Q01-Q04 to the first day of the quarter,
     * A01 to January 1st. M13 (annual average) and anything else yields null.
     */
    static LocalDate periodToDate(String year, String period) {
        if (year == null || period == null || period.length() < 2) return null;
        int y;
        int n;
        try {
            y = Integer.parseInt(year.trim());
            n = Integer.parseInt(period.substring(1));
        } catch (NumberFormatException e) {
            return null;
        }
        return switch (period.charAt(0)) {
            case 'M' -> n >= 1 && n <= 12 ? LocalDate.of(y, n, 1) : null;
            case 'Q' -> n >= 1 && n <= 4 ? LocalDate.of(y, (n - 1) * 3 + 1, 1) : null;
            case 'A' -> n == 1 ? LocalDate.of(y, 1, 1) : null;
            default -> null;
        };
    }
}
