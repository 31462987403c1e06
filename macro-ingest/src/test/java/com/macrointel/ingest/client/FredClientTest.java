package com.macrointel.ingest.client;

import com.macrointel.ingest.config.MacroIngestProperties;
import com.macrointel.ingest.exception.PermanentFetchException;
import com.macrointel.ingest.model.DataPoint;
import com.macrointel.ingest.model.FredObservationsResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FredClientTest {

    @Mock
    private RestTemplate restTemplate;

    private MacroIngestProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MacroIngestProperties();
        properties.getSources().getFred().setMinIntervalMs(0);
        properties.getSources().getFred().setApiKey("test-key");
    }

    private static FredObservationsResponse.Observation observation(String date, String value) {
        FredObservationsResponse.Observation o = new FredObservationsResponse.Observation();
        o.setDate(date);
        o.setValue(value);
        return o;
    }

    @Test
    void fetch_MapsMissingMarkerToNull() {
        FredObservationsResponse response = new FredObservationsResponse();
        response.setObservations(List.of(
                observation("2024-02-01", "5.33"),
                observation("2024-01-01", "."),
                observation(null, "1.0")));
        when(restTemplate.getForObject(any(URI.class), eq(FredObservationsResponse.class))).thenReturn(response);

        List<DataPoint> points = new FredClient(restTemplate, properties)
                .fetch("FEDFUNDS", LocalDate.of(2024, 1, 1), null);

        assertEquals(List.of(
                new DataPoint(LocalDate.of(2024, 1, 1), null),
                new DataPoint(LocalDate.of(2024, 2, 1), 5.33)), points);

        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        verify(restTemplate).getForObject(uri.capture(), eq(FredObservationsResponse.class));
        String query = uri.getValue().getQuery();
        assertTrue(query.contains("series_id=FEDFUNDS"));
        assertTrue(query.contains("observation_start=2024-01-01"));
        assertFalse(query.contains("observation_end"));
    }

    @Test
    void fetch_WithoutApiKeyFailsPermanently() {
        properties.getSources().getFred().setApiKey(" ");

        assertThrows(PermanentFetchException.class,
                () -> new FredClient(restTemplate, properties).fetch("FEDFUNDS", null, null));
        verifyNoInteractions(restTemplate);
    }
}
