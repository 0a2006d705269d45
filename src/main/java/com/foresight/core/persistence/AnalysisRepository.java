package com.foresight.core.persistence;

import com.foresight.core.model.Analysis;
import com.foresight.core.model.AnalysisReport;
import com.foresight.core.model.ErrorKind;
import com.foresight.core.model.ExecutionOutcome;
import com.foresight.core.model.Recommendation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Store for analyses and the recommendations generated from them.
 * <p>
 * Status updates are compare-and-swap: each {@code mark*} method only applies when
 * the recommendation is in the expected source status and reports whether it did.
 * Unless noted otherwise, store failures surface as {@link RepositoryException}.
 */
public interface AnalysisRepository {

    /**
     * Saves the analysis and its recommendations atomically. Null or incomplete
     * recommendations are skipped.
     */
    void saveAnalysis(Analysis analysis, List<Recommendation> recommendations);

    Optional<AnalysisReport> getById(String analysisId);

    /**
     * Most recent first.
     */
    List<Analysis> listByAgent(String agentId, int limit);

    /**
     * Ordered by priority descending, then confidence descending.
     */
    List<Recommendation> listActionsByAnalysis(String analysisId);

    /**
     * @throws RecommendationNotFoundException if no recommendation has that id
     */
    Recommendation getActionById(String recommendationId);

    /** pending → rejected. */
    boolean markRejected(String recommendationId, Instant decidedAt);

    /** pending → executing. */
    boolean markExecuting(String recommendationId, Instant decidedAt);

    /** executing → completed. */
    boolean markCompleted(String recommendationId, ExecutionOutcome result, Instant executedAt);

    /** executing → failed. */
    boolean markFailed(String recommendationId, String error, ErrorKind errorKind, Instant executedAt);

    /**
     * Deletes the analysis and, by cascade, its recommendations.
     *
     * @return {@code false} if no such analysis existed
     */
    boolean deleteAnalysis(String analysisId);
}
