package com.macrointel.ingest.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.macrointel.ingest.config.MacroIngestProperties;
import com.macrointel.ingest.exception.PermanentFetchException;
import com.macrointel.ingest.model.DataPoint;
import com.macrointel.ingest.model.DataSource;
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
import java.util.Map;

/**
 * Client for the U.S. Treasury Fiscal Data API. Public, no key.
 *
 * The API is organised by dataset rather than by series, so each internal series id is
 * mapped to a dataset endpoint, a row filter and the field holding the value.
 */
@Service
@Slf4j
public class TreasuryClient implements SeriesFetchClient {

    record Dataset(String endpoint, String filter, String valueField, String dateField) {}

    private static final String AVG_RATES = "v2/accounting/od/avg_interest_rates";
    private static final String AUCTIONS = "v1/accounting/od/auctions_query";

    static final Map<String, Dataset> DATASETS = Map.of(
            "TREAS_AVG_BILLS", new Dataset(AVG_RATES, "security_type_desc:eq:Treasury Bills", "avg_interest_rate_amt", "record_date"),
            "TREAS_AVG_NOTES", new Dataset(AVG_RATES, "security_type_desc:eq:Treasury Notes", "avg_interest_rate_amt", "record_date"),
            "TREAS_AVG_BONDS", new Dataset(AVG_RATES, "security_type_desc:eq:Treasury Bonds", "avg_interest_rate_amt", "record_date"),
            "TREAS_AVG_TIPS", new Dataset(AVG_RATES,
                    "security_type_desc:eq:Treasury Inflation-Protected Securities (TIPS)", "avg_interest_rate_amt", "record_date"),
            "TREAS_AUCTION_2Y", new Dataset(AUCTIONS, "security_term:eq:2-Year", "high_investment_rate", "auction_date"),
            "TREAS_AUCTION_10Y", new Dataset(AUCTIONS, "security_term:eq:10-Year", "high_investment_rate", "auction_date"),
            "TREAS_AUCTION_30Y", new Dataset(AUCTIONS, "security_term:eq:30-Year", "high_investment_rate", "auction_date"),
            "TREAS_BID_COVER_10Y", new Dataset(AUCTIONS, "security_term:eq:10-Year", "bid_to_cover_ratio", "auction_date")
    );

    private static final int PAGE_SIZE = 10000;

    private final RestTemplate restTemplate;
    private final MacroIngestProperties.Sources.Provider config;
    private final RequestPacer pacer;

    public TreasuryClient(RestTemplate restTemplate, MacroIngestProperties properties) {
        this.restTemplate = restTemplate;
        this.config = properties.getSources().getTreasury();
        this.pacer = new RequestPacer(config.getMinIntervalMs());
    }

    @Override
    public DataSource source() {
        return DataSource.TREASURY;
    }

    @Override
    @Retry(name = "treasury")
    public List<DataPoint> fetch(String requestSeriesId, LocalDate start, LocalDate end) {
        Dataset dataset = DATASETS.get(requestSeriesId);
        if (dataset == null) {
            throw new PermanentFetchException("TREASURY " + requestSeriesId + ": unknown series, known ids are "
                    + DATASETS.keySet());
        }

        List<String> filters = new ArrayList<>();
        filters.add(dataset.filter());
        if (start != null) filters.add(dataset.dateField() + ":gte:" + start);
        if (end != null) filters.add(dataset.dateField() + ":lte:" + end);

        URI uri = UriComponentsBuilder
                .fromHttpUrl(config.getBaseUrl() + dataset.endpoint())
                .queryParam("fields", dataset.dateField() + "," + dataset.valueField())
                .queryParam("filter", String.join(",", filters))
                .queryParam("sort", dataset.dateField())
                .queryParam("page[size]", PAGE_SIZE)
                .build()
                .encode()
                .toUri();

        log.debug("Fetching Treasury series {} from {}", requestSeriesId, uri);
        pacer.await();

        JsonNode body;
        try {
            body = restTemplate.getForObject(uri, JsonNode.class);
        } catch (RestClientException e) {
            throw ProviderErrors.translate("TREASURY", requestSeriesId, e);
        }
        if (body == null || !body.path("data").isArray()) {
            throw new PermanentFetchException("TREASURY " + requestSeriesId + ": response has no data array");
        }

        List<DataPoint> points = new ArrayList<>();
        for (JsonNode row : body.path("data")) {
            String rawDate = row.path(dataset.dateField()).asText(null);
            if (rawDate == null) continue;
            try {
                points.add(new DataPoint(LocalDate.parse(rawDate),
                        ProviderErrors.parseValue(row.path(dataset.valueField()).asText(null))));
            } catch (DateTimeParseException e) {
                log.warn("Skipping Treasury row with bad date '{}' for {}", rawDate, requestSeriesId);
            }
        }
        points.sort(Comparator.comparing(DataPoint::date));

        log.info("Fetched {} observations for Treasury series {}", points.size(), requestSeriesId);
        return points;
    }
}
