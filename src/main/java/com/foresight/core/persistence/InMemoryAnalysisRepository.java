package com.foresight.core.persistence;

import com.foresight.core.model.Analysis;
import com.foresight.core.model.AnalysisReport;
import com.foresight.core.model.ErrorKind;
import com.foresight.core.model.ExecutionOutcome;
import com.foresight.core.model.Recommendation;
import com.foresight.core.model.RecommendationStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Map-backed repository for development and tests. Not durable across restarts.
 */
public class InMemoryAnalysisRepository implements AnalysisRepository {

    static final Comparator<Recommendation> ACTION_ORDER = Comparator
            .comparingInt((Recommendation r) -> r.priority().ordinalValue()).reversed()
            .thenComparing(Comparator.comparingDouble(Recommendation::confidence).reversed());

    private final Map<String, Analysis> analyses = new ConcurrentHashMap<>();
    private final Map<String, Recommendation> recommendations = new ConcurrentHashMap<>();

    @Override
    public synchronized void saveAnalysis(Analysis analysis, List<Recommendation> recs) {
        Objects.requireNonNull(analysis, "analysis");
        if (recs != null) {
            recs.stream()
                    .filter(Objects::nonNull)
                    .filter(Recommendation::isComplete)
                    .filter(r -> analysis.id().equals(r.analysisId()))
                    .forEach(r -> recommendations.put(r.id(), r));
        }
        // Published last: readers go through the analysis, so they never see a partial set.
        analyses.put(analysis.id(), analysis);
    }

    @Override
    public Optional<AnalysisReport> getById(String analysisId) {
        return Optional.ofNullable(analyses.get(analysisId))
                .map(a -> new AnalysisReport(a, listActionsByAnalysis(analysisId)));
    }

    @Override
    public List<Analysis> listByAgent(String agentId, int limit) {
        return analyses.values().stream()
                .filter(a -> a.agentId().equals(agentId))
                .sorted(Comparator.comparing(Analysis::createdAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public List<Recommendation> listActionsByAnalysis(String analysisId) {
        return recommendations.values().stream()
                .filter(r -> r.analysisId().equals(analysisId))
                .sorted(ACTION_ORDER)
                .toList();
    }

    @Override
    public Recommendation getActionById(String recommendationId) {
        var rec = recommendations.get(recommendationId);
        if (rec == null) {
            throw new RecommendationNotFoundException(recommendationId);
        }
        return rec;
    }

    @Override
    public boolean markRejected(String recommendationId, Instant decidedAt) {
        return swap(recommendationId, RecommendationStatus.PENDING, r -> r.rejected(decidedAt));
    }

    @Override
    public boolean markExecuting(String recommendationId, Instant decidedAt) {
        return swap(recommendationId, RecommendationStatus.PENDING, r -> r.executing(decidedAt));
    }

    @Override
    public boolean markCompleted(String recommendationId, ExecutionOutcome result, Instant executedAt) {
        return swap(recommendationId, RecommendationStatus.EXECUTING, r -> r.completed(result, executedAt));
    }

    @Override
    public boolean markFailed(String recommendationId, String error, ErrorKind errorKind, Instant executedAt) {
        return swap(recommendationId, RecommendationStatus.EXECUTING, r -> r.failed(error, errorKind, executedAt));
    }

    @Override
    public synchronized boolean deleteAnalysis(String analysisId) {
        if (analyses.remove(analysisId) == null) {
            return false;
        }
        recommendations.values().removeIf(r -> r.analysisId().equals(analysisId));
        return true;
    }

    private boolean swap(String id, RecommendationStatus expected, UnaryOperator<Recommendation> update) {
        var applied = new boolean[1];
        recommendations.computeIfPresent(id, (key, current) -> {
            if (current.status() != expected) {
                return current;
            }
            applied[0] = true;
            return update.apply(current);
        });
        return applied[0];
    }
}
