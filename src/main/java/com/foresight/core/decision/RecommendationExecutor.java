package com.foresight.core.decision;

import com.foresight.core.host.CapabilityResult;
import com.foresight.core.host.HostEnvironment;
import com.foresight.core.host.ResultRegistry;
import com.foresight.core.logging.MdcContext;
import com.foresight.core.metrics.ForesightMetrics;
import com.foresight.core.model.ErrorKind;
import com.foresight.core.model.ExecutionOutcome;
import com.foresight.core.model.Recommendation;
import com.foresight.core.model.RecommendationStatus;
import com.foresight.core.persistence.AnalysisRepository;
import com.foresight.core.world.WorldManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Background execution of an accepted recommendation.
 * <p>
 * Always leaves the recommendation in a terminal status: {@code completed} with the
 * capability's result, or {@code failed} with an error message and an
 * {@link ErrorKind}. Nothing thrown here escapes {@link #execute}.
 */
@Component
public class RecommendationExecutor {

    private static final Logger log = LoggerFactory.getLogger(RecommendationExecutor.class);

    static final String NO_RESULT = "No result returned from action";
    static final String DEFAULT_FAILURE = "Action execution failed";

    private final AnalysisRepository repository;
    private final HostEnvironment host;
    private final ResultRegistry registry;
    private final WorldManager worldManager;
    private final ForesightMetrics metrics;
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    public RecommendationExecutor(AnalysisRepository repository, HostEnvironment host, ResultRegistry registry,
                                  WorldManager worldManager, ForesightMetrics metrics) {
        this.repository = repository;
        this.host = host;
        this.registry = registry;
        this.worldManager = worldManager;
        this.metrics = metrics;
    }

    public void execute(String recommendationId) {
        MdcContext.setRecommendation(recommendationId);
        String roomId = null;
        try {
            Recommendation rec = repository.getActionById(recommendationId);
            if (rec.status() != RecommendationStatus.EXECUTING) {
                log.warn("Recommendation {} is {} rather than executing; not running it",
                        recommendationId, rec.status().value());
                return;
            }
            String capabilityName = rec.capabilityType();
            if (host.findCapability(capabilityName).isEmpty()) {
                fail(recommendationId, "Action " + capabilityName + " not found in host environment",
                        ErrorKind.INITIALIZATION);
                return;
            }

            roomId = worldManager.openRoom();
            String correlationId = UUID.randomUUID().toString();
            log.info("Executing recommendation {} via {} [{}]", recommendationId, capabilityName, correlationId);
            host.dispatch(correlationId, rec.triggerPhrase(), capabilityName);

            CapabilityResult result = registry.get(correlationId).orElse(null);
            registry.remove(correlationId);
            if (result == null) {
                fail(recommendationId, NO_RESULT, ErrorKind.EXECUTION);
            } else if (result.success()) {
                complete(recommendationId, result);
            } else {
                String error = result.error() != null && !result.error().isBlank() ? result.error() : DEFAULT_FAILURE;
                fail(recommendationId, error, ErrorKind.EXECUTION);
            }
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : DEFAULT_FAILURE;
            log.error("Background execution of recommendation {} failed: {}", recommendationId, message, e);
            fail(recommendationId, message, ErrorKind.fromMessage(message));
        } finally {
            if (roomId != null) {
                worldManager.cleanup(List.of(roomId));
            }
            MdcContext.clear();
        }
    }

    private void complete(String recommendationId, CapabilityResult result) {
        var outcome = new ExecutionOutcome(outcomeText(result), result.data(), Instant.now());
        if (repository.markCompleted(recommendationId, outcome, Instant.now())) {
            metrics.recordRecommendationOutcome(RecommendationStatus.COMPLETED.value());
            log.info("Recommendation {} completed", recommendationId);
        } else {
            log.warn("Recommendation {} was no longer executing; completion not recorded", recommendationId);
        }
    }

    private void fail(String recommendationId, String error, ErrorKind kind) {
        try {
            if (repository.markFailed(recommendationId, error, kind, Instant.now())) {
                metrics.recordRecommendationOutcome(RecommendationStatus.FAILED.value());
                log.warn("Recommendation {} failed ({}): {}", recommendationId, kind.value(), error);
            } else {
                log.warn("Recommendation {} was no longer executing; failure not recorded: {}",
                        recommendationId, error);
            }
        } catch (Exception e) {
            log.error("Could not record failure of recommendation {}: {}", recommendationId, e.getMessage(), e);
        }
    }

    private String outcomeText(CapabilityResult result) {
        if (result.text() != null && !result.text().isBlank()) {
            return result.text();
        }
        if (result.data() == null) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(result.data());
        } catch (JsonProcessingException e) {
            return String.valueOf(result.data());
        }
    }
}
