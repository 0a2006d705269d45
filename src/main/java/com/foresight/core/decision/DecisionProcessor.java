package com.foresight.core.decision;

import com.foresight.core.engine.ExecutorConfig;
import com.foresight.core.metrics.ForesightMetrics;
import com.foresight.core.model.Decision;
import com.foresight.core.model.DecisionResult;
import com.foresight.core.model.DecisionResult.RejectedDecision;
import com.foresight.core.model.ErrorKind;
import com.foresight.core.model.Recommendation;
import com.foresight.core.model.RecommendationStatus;
import com.foresight.core.persistence.AnalysisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Applies human accept/reject decisions to pending recommendations.
 * <p>
 * Both transitions out of {@code pending} are compare-and-swap, so a recommendation
 * is decided at most once and an accepted one is dispatched at most once. Acceptance
 * returns as soon as the recommendation is marked {@code executing}; the capability
 * runs on the background executor via {@link RecommendationExecutor}.
 */
@Service
public class DecisionProcessor {

    private static final Logger log = LoggerFactory.getLogger(DecisionProcessor.class);

    static final String SCHEDULING_FAILED = "Execution could not be scheduled";

    private final AnalysisRepository repository;
    private final RecommendationExecutor recommendationExecutor;
    private final Executor backgroundExecutor;
    private final ForesightMetrics metrics;

    private final Map<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();

    public DecisionProcessor(AnalysisRepository repository, RecommendationExecutor recommendationExecutor,
                             @Qualifier(ExecutorConfig.BACKGROUND) Executor backgroundExecutor,
                             ForesightMetrics metrics) {
        this.repository = repository;
        this.recommendationExecutor = recommendationExecutor;
        this.backgroundExecutor = backgroundExecutor;
        this.metrics = metrics;
    }

    /**
     * Processes every decision in order. A decision that fails is logged and left out
     * of both result lists; it never stops the rest of the batch.
     */
    public DecisionResult process(List<Decision> decisions) {
        var accepted = new ArrayList<Recommendation>();
        var rejected = new ArrayList<RejectedDecision>();
        for (Decision decision : decisions) {
            try {
                switch (decision.verdict()) {
                    case ACCEPT -> accept(decision.recommendationId()).ifPresent(accepted::add);
                    case REJECT -> {
                        if (reject(decision.recommendationId())) {
                            rejected.add(new RejectedDecision(decision.recommendationId(),
                                    RecommendationStatus.REJECTED.value()));
                        }
                    }
                }
            } catch (Exception e) {
                log.warn("Skipping decision {} on {}: {}", decision.verdict(), decision.recommendationId(),
                        e.getMessage());
            }
        }
        log.info("Processed {} decision(s): {} accepted, {} rejected", decisions.size(), accepted.size(),
                rejected.size());
        return new DecisionResult(accepted, rejected);
    }

    /**
     * Marks the recommendation rejected. No capability is invoked.
     *
     * @return {@code false} if it was no longer pending
     */
    public boolean reject(String recommendationId) {
        repository.getActionById(recommendationId);
        if (!repository.markRejected(recommendationId, Instant.now())) {
            log.warn("Recommendation {} is not pending; reject ignored", recommendationId);
            return false;
        }
        metrics.recordDecision("reject");
        log.info("Recommendation {} rejected", recommendationId);
        return true;
    }

    /**
     * Marks the recommendation executing and schedules its execution.
     *
     * @return the recommendation as it now stands, or empty if it was no longer pending
     */
    public Optional<Recommendation> accept(String recommendationId) {
        Recommendation current = repository.getActionById(recommendationId);
        Instant decidedAt = Instant.now();
        if (!repository.markExecuting(recommendationId, decidedAt)) {
            log.warn("Recommendation {} is not pending; accept ignored", recommendationId);
            return Optional.empty();
        }
        metrics.recordDecision("accept");
        log.info("Recommendation {} accepted, scheduling {}", recommendationId, current.capabilityType());

        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> recommendationExecutor.execute(recommendationId),
                    backgroundExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule recommendation {}: {}", recommendationId, e.getMessage());
            if (repository.markFailed(recommendationId, SCHEDULING_FAILED, ErrorKind.EXECUTION, Instant.now())) {
                metrics.recordRecommendationOutcome(RecommendationStatus.FAILED.value());
            }
            return Optional.of(repository.getActionById(recommendationId));
        }
        inFlight.put(recommendationId, future);
        future.whenComplete((ignored, error) -> inFlight.remove(recommendationId, future));

        return Optional.of(current.status() == RecommendationStatus.PENDING ? current.executing(decidedAt) : current);
    }

    /**
     * The background execution of an accepted recommendation, while it is still running.
     */
    public Optional<CompletableFuture<Void>> inFlight(String recommendationId) {
        return Optional.ofNullable(inFlight.get(recommendationId));
    }
}
