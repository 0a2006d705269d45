package com.foresight.dispatch.api;

import com.foresight.core.decision.DecisionProcessor;
import com.foresight.core.model.Decision;
import com.foresight.core.model.Verdict;
import com.foresight.core.persistence.AnalysisRepository;
import com.foresight.core.persistence.RecommendationNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Map;

/**
 * REST controller for individual recommendations and human decisions on them.
 */
@RestController
@RequestMapping("/api/v1")
public class ActionController {

    private final AnalysisRepository repository;
    private final DecisionProcessor decisionProcessor;

    public ActionController(AnalysisRepository repository, DecisionProcessor decisionProcessor) {
        this.repository = repository;
        this.decisionProcessor = decisionProcessor;
    }

    /**
     * GET /api/v1/action/{id}: A single recommendation.
     */
    @GetMapping("/action/{id}")
    public ResponseEntity<?> getAction(@PathVariable String id) {
        try {
            return ResponseEntity.ok(repository.getActionById(id));
        } catch (RecommendationNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Action not found"));
        }
    }

    /**
     * POST /api/v1/actions/decide: Accepts or rejects recommendations.
     * Every decision is validated before any is applied. Accepted actions run in
     * the background; decisions that fail internally appear in neither list.
     */
    @PostMapping("/actions/decide")
    public ResponseEntity<?> decide(@RequestBody DecideRequest request) {
        if (request == null || request.decisions() == null || request.decisions().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "decisions must be a non-empty array"));
        }

        var decisions = new ArrayList<Decision>();
        for (int i = 0; i < request.decisions().size(); i++) {
            var item = request.decisions().get(i);
            if (item == null || item.actionId() == null || item.actionId().isBlank()) {
                return ResponseEntity.badRequest().body(
                        Map.of("error", "decisions[" + i + "].actionId must be a non-empty string"));
            }
            var verdict = Verdict.parse(item.decision());
            if (verdict.isEmpty()) {
                return ResponseEntity.badRequest().body(
                        Map.of("error", "decisions[" + i + "].decision must be 'accept' or 'reject'"));
            }
            decisions.add(new Decision(item.actionId(), verdict.get()));
        }

        var result = decisionProcessor.process(decisions);
        return ResponseEntity.ok(new DecideResponse(decisions.size(), result.accepted(), result.rejected()));
    }
}
