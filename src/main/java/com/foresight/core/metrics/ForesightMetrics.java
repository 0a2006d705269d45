package com.foresight.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for analysis runs and recommendation execution.
 */
@Service
public class ForesightMetrics {

    private final MeterRegistry registry;

    public ForesightMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysisDuration(long ms) {
        Timer.builder("foresight.analysis.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAnalysisResult(String status) {
        Counter.builder("foresight.analysis.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Counts an inference call whose failure was isolated to its own branch.
     *
     * @param stage "classify", "select_data", "select_actions" or "recommend"
     */
    public void recordInferenceFailure(String stage) {
        Counter.builder("foresight.inference.failures")
                .description("Isolated per-item inference failures")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordCapabilityExecution(boolean success) {
        Counter.builder("foresight.capability.executions")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordDecision(String verdict) {
        Counter.builder("foresight.decisions.total")
                .tag("verdict", verdict)
                .register(registry)
                .increment();
    }

    public void recordRecommendationOutcome(String status) {
        Counter.builder("foresight.recommendations.outcomes")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRecommendationsGenerated(int count) {
        DistributionSummary.builder("foresight.recommendations.generated")
                .description("Recommendations produced per analysis")
                .register(registry)
                .record(count);
    }
}
