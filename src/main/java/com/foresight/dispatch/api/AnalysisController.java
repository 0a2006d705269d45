package com.foresight.dispatch.api;

import com.foresight.core.engine.AnalysisEngine;
import com.foresight.core.host.AgentProperties;
import com.foresight.core.model.Analysis;
import com.foresight.core.model.AnalysisReport;
import com.foresight.core.model.Recommendation;
import com.foresight.core.persistence.AnalysisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for analysis runs and their results.
 */
@RestController
@RequestMapping("/api/v1/analysis")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 100;

    private final AnalysisEngine analysisEngine;
    private final AnalysisRepository repository;
    private final AgentProperties agent;

    public AnalysisController(AnalysisEngine analysisEngine, AnalysisRepository repository, AgentProperties agent) {
        this.analysisEngine = analysisEngine;
        this.repository = repository;
        this.agent = agent;
    }

    /**
     * GET /api/v1/analysis?limit=N: Most recent analyses for this agent.
     * {@code limit} defaults to 10 and is capped at 100.
     */
    @GetMapping
    public ResponseEntity<?> listAnalyses(@RequestParam(name = "limit", required = false) String limit) {
        int effective = DEFAULT_LIMIT;
        if (limit != null) {
            try {
                effective = Integer.parseInt(limit.trim());
            } catch (NumberFormatException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "limit must be a number"));
            }
            if (effective < 1) {
                return ResponseEntity.badRequest().body(Map.of("error", "limit must be at least 1"));
            }
        }
        List<Analysis> analyses = repository.listByAgent(agent.getId(), Math.min(effective, MAX_LIMIT));
        return ResponseEntity.ok(analyses);
    }

    /**
     * POST /api/v1/analysis: Starts a run. Returns 202 immediately; the analysis
     * becomes retrievable under the returned id once the run completes.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> triggerAnalysis() {
        String analysisId = analysisEngine.submitAnalysis(agent.getId());
        log.info("Accepted analysis {} for agent {}", analysisId, agent.getId());
        return ResponseEntity.accepted().body(Map.of(
                "analysisId", analysisId,
                "status", "PROCESSING",
                "message", "Analysis started"));
    }

    /**
     * GET /api/v1/analysis/{id}: An analysis with its recommendations.
     */
    @GetMapping("/{id}")
    public ResponseEntity<AnalysisReport> getAnalysis(@PathVariable String id) {
        return repository.getById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/analysis/{id}/actions: Recommendations, highest priority first.
     */
    @GetMapping("/{id}/actions")
    public ResponseEntity<List<Recommendation>> getActions(@PathVariable String id) {
        return repository.getById(id)
                .map(report -> ResponseEntity.ok(report.recommendations()))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * DELETE /api/v1/analysis/{id}: Removes an analysis and its recommendations.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAnalysis(@PathVariable String id) {
        if (!repository.deleteAnalysis(id)) {
            return ResponseEntity.notFound().build();
        }
        log.info("Deleted analysis {}", id);
        return ResponseEntity.noContent().build();
    }
}
