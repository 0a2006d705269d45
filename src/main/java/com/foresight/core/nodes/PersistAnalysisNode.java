package com.foresight.core.nodes;

import com.foresight.core.model.Analysis;
import com.foresight.core.model.AnalysisSections;
import com.foresight.core.model.AnalysisStage;
import com.foresight.core.persistence.AnalysisRepository;
import com.foresight.core.state.AnalysisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Assembles the {@link Analysis} and saves it together with its recommendations.
 * Store failures propagate and fail the run.
 */
@Component
public class PersistAnalysisNode {

    private static final Logger log = LoggerFactory.getLogger(PersistAnalysisNode.class);

    private final AnalysisRepository repository;

    public PersistAnalysisNode(AnalysisRepository repository) {
        this.repository = repository;
    }

    public Map<String, Object> apply(AnalysisState state) {
        AnalysisSections sections = state.sections()
                .orElseThrow(() -> new IllegalStateException("No analysis narrative to persist"));
        Instant now = Instant.now();
        long started = state.startedAt() > 0 ? state.startedAt() : now.toEpochMilli();
        var analysis = new Analysis(
                state.analysisId(),
                state.agentId(),
                now,
                sections,
                state.capabilitiesUsed(),
                Math.max(0, now.toEpochMilli() - started));

        repository.saveAnalysis(analysis, state.recommendations());
        log.info("Persisted analysis {} ({} ms)", analysis.id(), analysis.executionTimeMs());
        return Map.of(
                AnalysisState.ANALYSIS, analysis,
                AnalysisState.STAGE, AnalysisStage.COMPLETED.name()
        );
    }
}
