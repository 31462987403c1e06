package com.macrointel.ingest.client;

import com.macrointel.ingest.config.MacroIngestProperties;
import com.macrointel.ingest.exception.PermanentFetchException;
import com.macrointel.ingest.exception.QuotaExhaustedException;
import com.macrointel.ingest.exception.RateLimitExceededException;
import com.macrointel.ingest.exception.TransientFetchException;
import com.macrointel.ingest.model.BlsResponse;
import com.macrointel.ingest.model.DataPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlsClientTest {

    private static final LocalDate START = LocalDate.of(2023, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 3, 1);

    @Mock
    private RestTemplate restTemplate;

    private BlsClient client;

    @BeforeEach
    void setUp() {
        MacroIngestProperties properties = new MacroIngestProperties();
        properties.getSources().getBls().setMinIntervalMs(0);
        client = new BlsClient(restTemplate, properties);
    }

    private static BlsResponse.Point point(String year, String period, String value) {
        BlsResponse.Point p = new BlsResponse.Point();
        p.setYear(year);
        p.setPeriod(period);
        p.setValue(value);
        return p;
    }

    private static BlsResponse succeeded(BlsResponse.Point... points) {
        BlsResponse.Series series = new BlsResponse.Series();
        series.setSeriesId("LNS14000000");
        series.setData(List.of(points));
        BlsResponse.Results results = new BlsResponse.Results();
        results.setSeries(List.of(series));
        BlsResponse response = new BlsResponse();
        response.setStatus(BlsClient.STATUS_SUCCEEDED);
        response.setResults(results);
        return response;
    }

    private static BlsResponse notProcessed(String message) {
        BlsResponse response = new BlsResponse();
        response.setStatus("REQUEST_NOT_PROCESSED");
        response.setMessage(List.of(message));
        return response;
    }

    @Test
    @DisplayName("Periods map to the first day of their month, quarter or year")
    void testPeriodToDate() {
        assertEquals(LocalDate.of(2024, 1, 1), BlsClient.periodToDate("2024", "M01"));
        assertEquals(LocalDate.of(2024, 12, 1), BlsClient.periodToDate("2024", "M12"));
        assertEquals(LocalDate.of(2024, 7, 1), BlsClient.periodToDate("2024", "Q03"));
        assertEquals(LocalDate.of(2024, 1, 1), BlsClient.periodToDate("2024", "A01"));
        assertNull(BlsClient.periodToDate("2024", "M13"));
        assertNull(BlsClient.periodToDate("2024", "S01"));
        assertNull(BlsClient.periodToDate("abcd", "M01"));
    }

    @Test
    @DisplayName("Points are filtered to the window, sorted ascending and skip annual averages")
    void testFetch_ParsesAndSorts() {
        when(restTemplate.postForObject(anyString(), any(), eq(BlsResponse.class))).thenReturn(succeeded(
                point("2024", "M02", "3.9"),
                point("2024", "M01", "3.7"),
                point("2023", "M13", "3.6"),
                point("2022", "M12", "3.5"),
                point("2023", "M12", "-")));

        List<DataPoint> points = client.fetch("LNS14000000", START, END);

        assertEquals(List.of(
                new DataPoint(LocalDate.of(2023, 12, 1), null),
                new DataPoint(LocalDate.of(2024, 1, 1), 3.7),
                new DataPoint(LocalDate.of(2024, 2, 1), 3.9)), points);
    }

    @Test
    @DisplayName("A daily threshold message is reported as quota exhaustion")
    void testFetch_DailyQuota() {
        when(restTemplate.postForObject(anyString(), any(), eq(BlsResponse.class))).thenReturn(notProcessed(
                "Request could not be serviced, as the daily threshold for total number of requests allocated "
                        + "to the user has been reached."));

        QuotaExhaustedException e = assertThrows(QuotaExhaustedException.class,
                () -> client.fetch("LNS14000000", START, END));
        assertInstanceOf(RateLimitExceededException.class, e);
        assertEquals("FETCH-003", e.getErrorCode());
    }

    @Test
    @DisplayName("Any other refusal is permanent")
    void testFetch_OtherFailure() {
        when(restTemplate.postForObject(anyString(), any(), eq(BlsResponse.class)))
                .thenReturn(notProcessed("Series does not exist for Series NOPE"));

        assertThrows(PermanentFetchException.class, () -> client.fetch("NOPE", START, END));
    }

    @Test
    @DisplayName("Server errors are transient")
    void testFetch_ServerError() {
        when(restTemplate.postForObject(anyString(), any(), eq(BlsResponse.class)))
                .thenThrow(new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE));

        TransientFetchException e = assertThrows(TransientFetchException.class,
                () -> client.fetch("LNS14000000", START, END));
        assertTrue(e.getMessage().contains("503"));
    }

    @Test
    @DisplayName("A succeeded response without series or data yields no points")
    void testFetch_NullSeriesOrData() {
        BlsResponse noSeries = succeeded();
        noSeries.getResults().setSeries(null);
        BlsResponse noData = succeeded();
        noData.getResults().getSeries().get(0).setData(null);
        when(restTemplate.postForObject(anyString(), any(), eq(BlsResponse.class)))
                .thenReturn(noSeries)
                .thenReturn(noData);

        assertTrue(client.fetch("LNS14000000", START, END).isEmpty());
        assertTrue(client.fetch("LNS14000000", START, END).isEmpty());
    }

    @Test
    void testIsDailyQuotaMessage() {
        assertTrue(BlsClient.isDailyQuotaMessage("daily threshold reached"));
        assertTrue(BlsClient.isDailyQuotaMessage("The THRESHOLD FOR DAILY queries was hit"));
        assertFalse(BlsClient.isDailyQuotaMessage("Invalid series id"));
    }
}
