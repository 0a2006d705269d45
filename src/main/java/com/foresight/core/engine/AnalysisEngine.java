package com.foresight.core.engine;

import com.foresight.core.graph.AnalysisGraph;
import com.foresight.core.logging.MdcContext;
import com.foresight.core.metrics.ForesightMetrics;
import com.foresight.core.model.AnalysisReport;
import com.foresight.core.model.AnalysisStage;
import com.foresight.core.state.AnalysisState;
import com.foresight.core.world.WorldManager;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point for analysis runs.
 * <p>
 * Makes sure the agent's world exists, then drives the {@link AnalysisGraph}
 * from classification through persistence. An exception from any stage aborts
 * the run; nothing is persisted for a failed run.
 */
@Service
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final AnalysisGraph analysisGraph;
    private final WorldManager worldManager;
    private final ForesightMetrics metrics;
    private final Executor backgroundExecutor;

    public AnalysisEngine(AnalysisGraph analysisGraph, WorldManager worldManager, ForesightMetrics metrics,
                          @Qualifier(ExecutorConfig.BACKGROUND) Executor backgroundExecutor) {
        this.analysisGraph = analysisGraph;
        this.worldManager = worldManager;
        this.metrics = metrics;
        this.backgroundExecutor = backgroundExecutor;
    }

    public AnalysisReport runAnalysis(String agentId) {
        return runAnalysis(generateAnalysisId(), agentId);
    }

    /**
     * Runs the full pipeline synchronously.
     *
     * @return the persisted analysis and its recommendations
     */
    public AnalysisReport runAnalysis(String analysisId, String agentId) {
        MdcContext.setAnalysis(analysisId, agentId);
        long start = System.currentTimeMillis();
        try {
            log.info("Starting analysis {} for agent {}", analysisId, agentId);
            worldManager.ensureAgentWorld();

            Map<String, Object> initialState = Map.of(
                    AnalysisState.ANALYSIS_ID, analysisId,
                    AnalysisState.AGENT_ID, agentId,
                    AnalysisState.STARTED_AT, start,
                    AnalysisState.STAGE, AnalysisStage.CLASSIFYING.name());

            var config = RunnableConfig.builder()
                    .threadId(analysisId)
                    .build();

            var state = analysisGraph.getCompiledGraph()
                    .invoke(initialState, config)
                    .orElseThrow(() -> new IllegalStateException(
                            "Graph execution returned empty state for analysis " + analysisId));

            var analysis = state.analysis().orElseThrow(() -> new IllegalStateException(
                    "Analysis " + analysisId + " ended at stage " + state.stage() + " without being persisted"));

            metrics.recordAnalysisResult("COMPLETED");
            log.info("Analysis {} completed with {} recommendation(s) in {} ms",
                    analysisId, state.recommendations().size(), analysis.executionTimeMs());
            return new AnalysisReport(analysis, state.recommendations());
        } catch (RuntimeException e) {
            metrics.recordAnalysisResult("FAILED");
            log.error("Analysis {} failed: {}", analysisId, e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordAnalysisDuration(System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    /**
     * Starts a run in the background and returns its id immediately. The analysis
     * becomes retrievable once the run has persisted it; a failed run is logged
     * and never becomes retrievable.
     */
    public String submitAnalysis(String agentId) {
        String analysisId = generateAnalysisId();
        CompletableFuture.runAsync(() -> runAnalysis(analysisId, agentId), backgroundExecutor)
                .exceptionally(e -> {
                    log.warn("Background analysis {} did not complete: {}", analysisId, e.getMessage());
                    return null;
                });
        return analysisId;
    }

    public String generateAnalysisId() {
        return UUID.randomUUID().toString();
    }
}
