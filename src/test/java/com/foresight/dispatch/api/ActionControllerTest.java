package com.foresight.dispatch.api;

import com.foresight.core.decision.DecisionProcessor;
import com.foresight.core.model.Decision;
import com.foresight.core.model.DecisionResult;
import com.foresight.core.model.DecisionResult.RejectedDecision;
import com.foresight.core.model.Priority;
import com.foresight.core.model.Recommendation;
import com.foresight.core.model.Verdict;
import com.foresight.core.persistence.AnalysisRepository;
import com.foresight.core.persistence.RecommendationNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ActionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ActionControllerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AnalysisRepository repository;

    @MockitoBean
    private DecisionProcessor decisionProcessor;

    private static Recommendation rec(String id) {
        return Recommendation.pending(id, "a-1", "defi:stake", "defi", Priority.HIGH, "Idle ETH", 0.8,
                "Stake 1 ETH", Map.of(), null, null, T0);
    }

    private void decideExpectingBadRequest(String body, String error) throws Exception {
        mockMvc.perform(post("/api/v1/actions/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(error));
        verify(decisionProcessor, never()).process(any());
    }

    // ── GET /api/v1/action/{id} ──────────────────────────────────────

    @Test
    @DisplayName("GET /action/{id} returns the recommendation")
    void getAction() throws Exception {
        when(repository.getActionById("r-1")).thenReturn(rec("r-1"));

        mockMvc.perform(get("/api/v1/action/r-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("r-1"))
                .andExpect(jsonPath("$.capabilityType").value("defi:stake"))
                .andExpect(jsonPath("$.status").value("pending"));
    }

    @Test
    @DisplayName("GET /action/{id} for unknown id returns 404 with an error body")
    void getActionNotFound() throws Exception {
        when(repository.getActionById("nope")).thenThrow(new RecommendationNotFoundException("nope"));

        mockMvc.perform(get("/api/v1/action/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Action not found"));
    }

    // ── POST /api/v1/actions/decide ──────────────────────────────────

    @Test
    @DisplayName("POST /actions/decide applies the batch and reports the split")
    void decide() throws Exception {
        when(decisionProcessor.process(any())).thenReturn(new DecisionResult(
                List.of(rec("r-1").executing(T0)),
                List.of(new RejectedDecision("r-2", "rejected"))));

        mockMvc.perform(post("/api/v1/actions/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"decisions":[
                                  {"actionId":"r-1","decision":"accept"},
                                  {"actionId":"r-2","decision":"REJECT"},
                                  {"actionId":"r-3","decision":"accept"}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(3))
                .andExpect(jsonPath("$.accepted", hasSize(1)))
                .andExpect(jsonPath("$.accepted[0].status").value("executing"))
                .andExpect(jsonPath("$.rejected[0].actionId").value("r-2"))
                .andExpect(jsonPath("$.rejected[0].status").value("rejected"));

        verify(decisionProcessor).process(argThat((List<Decision> decisions) -> decisions.equals(List.of(
                new Decision("r-1", Verdict.ACCEPT),
                new Decision("r-2", Verdict.REJECT),
                new Decision("r-3", Verdict.ACCEPT)))));
    }

    @Test
    @DisplayName("POST /actions/decide with an empty list returns 400")
    void decideEmpty() throws Exception {
        decideExpectingBadRequest("{\"decisions\":[]}", "decisions must be a non-empty array");
    }

    @Test
    @DisplayName("POST /actions/decide without decisions returns 400")
    void decideMissing() throws Exception {
        decideExpectingBadRequest("{}", "decisions must be a non-empty array");
    }

    @Test
    @DisplayName("POST /actions/decide with a blank actionId returns 400 naming the index")
    void decideBlankId() throws Exception {
        decideExpectingBadRequest("""
                {"decisions":[{"actionId":"r-1","decision":"accept"},{"actionId":" ","decision":"accept"}]}
                """, "decisions[1].actionId must be a non-empty string");
    }

    @Test
    @DisplayName("POST /actions/decide with an unknown verdict returns 400 and applies nothing")
    void decideBadVerdict() throws Exception {
        decideExpectingBadRequest("""
                {"decisions":[{"actionId":"r-1","decision":"maybe"}]}
                """, "decisions[0].decision must be 'accept' or 'reject'");
    }
}
