package com.macrointel.ingest.config;

import com.macrointel.ingest.alert.AlertEngine;
import com.macrointel.ingest.alert.DigestSummary;
import com.macrointel.ingest.model.DataSource;
import com.macrointel.ingest.model.IngestionMode;
import com.macrointel.ingest.model.RunHealthSummary;
import com.macrointel.ingest.model.Severity;
import com.macrointel.ingest.model.ValidationFinding;
import com.macrointel.ingest.output.RunRepository;
import com.macrointel.ingest.service.CatalogService;
import com.macrointel.ingest.service.IngestionOrchestrator;
import com.macrointel.ingest.service.RunHealthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.macrointel.ingest.support.TestFixtures.series;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class IngestControllerTest {

    @Mock
    private IngestionOrchestrator orchestrator;
    @Mock
    private RunHealthService runHealthService;
    @Mock
    private RunRepository runRepository;
    @Mock
    private AlertEngine alertEngine;
    @Mock
    private CatalogService catalogService;

    @InjectMocks
    private IngestController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    private static RunRepository.StoredRun storedRun(String runId) {
        return new RunRepository.StoredRun(runId, LocalDateTime.of(2024, 3, 1, 12, 0),
                "incremental", "success", 10, 10, 1.0, null);
    }

    @Test
    @DisplayName("Trigger accepts a valid mode and runs it in the background")
    void testTrigger() throws Exception {
        mockMvc.perform(post("/ingest/trigger").param("mode", "backfill"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.mode").value("backfill"));

        verify(orchestrator, timeout(2000)).run(IngestionMode.BACKFILL);
    }

    @Test
    @DisplayName("Trigger rejects an unknown mode")
    void testTrigger_BadMode() throws Exception {
        mockMvc.perform(post("/ingest/trigger").param("mode", "full"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid mode: full. Must be 'incremental' or 'backfill'."));

        verify(orchestrator, never()).run(any());
    }

    @Test
    @DisplayName("Latest health is 404 before any run exists")
    void testLatestHealth_NoRuns() throws Exception {
        when(runHealthService.latest()).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/latest/health")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Run health is returned with snake_case fields")
    void testRunHealth() throws Exception {
        when(runHealthService.forRun("run-1")).thenReturn(Optional.of(RunHealthSummary.builder()
                .runId("run-1").status("partial").mode("incremental")
                .dqCounts(Map.of("critical", 0, "warning", 1, "info", 0)).dqTotal(1)
                .build()));

        mockMvc.perform(get("/runs/run-1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.run_id").value("run-1"))
                .andExpect(jsonPath("$.dq_counts.warning").value(1));
    }

    @Test
    @DisplayName("Findings are filtered by severity for a known run")
    void testFindings() throws Exception {
        when(runRepository.findRun("run-1")).thenReturn(Optional.of(storedRun("run-1")));
        when(runRepository.findFindings("run-1", Severity.CRITICAL, 10)).thenReturn(List.of(
                ValidationFinding.builder().severity(Severity.CRITICAL).code("missing_series_data")
                        .seriesId("GDP").message("No rows fetched.").build()));

        mockMvc.perform(get("/runs/run-1/findings").param("severity", "critical").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].code").value("missing_series_data"))
                .andExpect(jsonPath("$[0].severity").value("critical"));
    }

    @Test
    @DisplayName("Findings rejects out-of-range limits, bad severities and unknown runs")
    void testFindings_Rejections() throws Exception {
        mockMvc.perform(get("/runs/run-1/findings").param("limit", "501"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/runs/run-1/findings").param("severity", "fatal"))
                .andExpect(status().isBadRequest());

        when(runRepository.findRun("nope")).thenReturn(Optional.empty());
        mockMvc.perform(get("/runs/nope/findings"))
                .andExpect(status().isNotFound());

        verify(runRepository, never()).findFindings(anyString(), any(), anyInt());
    }

    @Test
    @DisplayName("Digest reports an empty buffer")
    void testDigest_Empty() throws Exception {
        when(alertEngine.sendDigest()).thenReturn(Optional.empty());

        mockMvc.perform(post("/alerts/digest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("empty"));
    }

    @Test
    @DisplayName("Digest returns its summary")
    void testDigest() throws Exception {
        when(alertEngine.sendDigest()).thenReturn(Optional.of(
                new DigestSummary(LocalDate.of(2024, 3, 1), 1, 0, 2, 3)));

        mockMvc.perform(post("/alerts/digest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_count").value(3));
    }

    @Test
    @DisplayName("Catalog filters by source and tier")
    void testCatalog() throws Exception {
        when(catalogService.filterBySource(DataSource.BLS)).thenReturn(List.of(
                series("LNS14000000", DataSource.BLS),
                series("CES0000000001", DataSource.BLS).toBuilder().tier(2).build()));

        mockMvc.perform(get("/catalog").param("source", "bls").param("tier", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].seriesId").value("CES0000000001"));

        mockMvc.perform(get("/catalog").param("source", "ECB"))
                .andExpect(status().isBadRequest());
    }
}
