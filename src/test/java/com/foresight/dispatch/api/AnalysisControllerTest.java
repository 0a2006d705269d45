package com.foresight.dispatch.api;

import com.foresight.core.engine.AnalysisEngine;
import com.foresight.core.host.AgentProperties;
import com.foresight.core.model.Analysis;
import com.foresight.core.model.AnalysisReport;
import com.foresight.core.model.AnalysisSections;
import com.foresight.core.model.Priority;
import com.foresight.core.model.Recommendation;
import com.foresight.core.persistence.AnalysisRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalysisController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class AnalysisControllerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AnalysisEngine analysisEngine;

    @MockitoBean
    private AnalysisRepository repository;

    @MockitoBean
    private AgentProperties agent;

    @BeforeEach
    void setUp() {
        when(agent.getId()).thenReturn("agent-1");
    }

    private static Analysis analysis(String id) {
        return new Analysis(id, "agent-1", T0, new AnalysisSections("Holding 2 ETH", "Calm", "Low", "Stake"),
                List.of("wallet"), 1200);
    }

    private static Recommendation rec(String id, Priority priority) {
        return Recommendation.pending(id, "a-1", "defi:stake", "defi", priority, "Idle ETH", 0.8,
                "Stake 1 ETH", Map.of("amount", "1"), "+4% APY", null, T0);
    }

    // ── POST /api/v1/analysis ────────────────────────────────────────

    @Test
    @DisplayName("POST /analysis returns 202 with the new analysis id")
    void triggerAnalysis() throws Exception {
        when(analysisEngine.submitAnalysis("agent-1")).thenReturn("a-1");

        mockMvc.perform(post("/api/v1/analysis"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.analysisId").value("a-1"))
                .andExpect(jsonPath("$.status").value("PROCESSING"))
                .andExpect(jsonPath("$.message").value("Analysis started"));
    }

    // ── GET /api/v1/analysis ─────────────────────────────────────────

    @Test
    @DisplayName("GET /analysis defaults the limit to 10")
    void listDefaultLimit() throws Exception {
        when(repository.listByAgent("agent-1", 10)).thenReturn(List.of(analysis("a-2"), analysis("a-1")));

        mockMvc.perform(get("/api/v1/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value("a-2"))
                .andExpect(jsonPath("$[0].sections.overview").value("Holding 2 ETH"));
    }

    @Test
    @DisplayName("GET /analysis caps the limit at 100")
    void listCapsLimit() throws Exception {
        when(repository.listByAgent(anyString(), anyInt())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/analysis").param("limit", "500"))
                .andExpect(status().isOk());

        verify(repository).listByAgent("agent-1", 100);
    }

    @Test
    @DisplayName("GET /analysis with a non-numeric limit returns 400")
    void listBadLimit() throws Exception {
        mockMvc.perform(get("/api/v1/analysis").param("limit", "ten"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("limit must be a number"));

        verify(repository, never()).listByAgent(anyString(), anyInt());
    }

    @Test
    @DisplayName("GET /analysis with limit 0 returns 400")
    void listZeroLimit() throws Exception {
        mockMvc.perform(get("/api/v1/analysis").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("limit must be at least 1"));
    }

    // ── GET /api/v1/analysis/{id} ────────────────────────────────────

    @Test
    @DisplayName("GET /analysis/{id} returns the analysis with its recommendations")
    void getAnalysis() throws Exception {
        when(repository.getById("a-1")).thenReturn(Optional.of(new AnalysisReport(analysis("a-1"),
                List.of(rec("r-1", Priority.HIGH)))));

        mockMvc.perform(get("/api/v1/analysis/a-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.analysis.id").value("a-1"))
                .andExpect(jsonPath("$.recommendations", hasSize(1)))
                .andExpect(jsonPath("$.recommendations[0].priority").value("high"))
                .andExpect(jsonPath("$.recommendations[0].status").value("pending"))
                .andExpect(jsonPath("$.recommendations[0].complete").doesNotExist());
    }

    @Test
    @DisplayName("GET /analysis/{id} for unknown id returns 404")
    void getAnalysisNotFound() throws Exception {
        when(repository.getById("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/analysis/missing"))
                .andExpect(status().isNotFound());
    }

    // ── GET /api/v1/analysis/{id}/actions ────────────────────────────

    @Test
    @DisplayName("GET /analysis/{id}/actions returns the recommendations in stored order")
    void getActions() throws Exception {
        when(repository.getById("a-1")).thenReturn(Optional.of(new AnalysisReport(analysis("a-1"),
                List.of(rec("r-1", Priority.HIGH), rec("r-2", Priority.LOW)))));

        mockMvc.perform(get("/api/v1/analysis/a-1/actions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", contains("r-1", "r-2")))
                .andExpect(jsonPath("$[0].triggerPhrase").value("Stake 1 ETH"));
    }

    @Test
    @DisplayName("GET /analysis/{id}/actions for unknown id returns 404")
    void getActionsNotFound() throws Exception {
        when(repository.getById("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/analysis/missing/actions"))
                .andExpect(status().isNotFound());
    }

    // ── DELETE /api/v1/analysis/{id} ─────────────────────────────────

    @Test
    @DisplayName("DELETE /analysis/{id} returns 204")
    void deleteAnalysis() throws Exception {
        when(repository.deleteAnalysis("a-1")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/analysis/a-1"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("DELETE /analysis/{id} for unknown id returns 404")
    void deleteAnalysisNotFound() throws Exception {
        when(repository.deleteAnalysis("missing")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/analysis/missing"))
                .andExpect(status().isNotFound());
    }
}
