package com.foresight.core.nodes;

import com.foresight.core.engine.BoundedFanOut;
import com.foresight.core.llm.LlmService;
import com.foresight.core.metrics.ForesightMetrics;
import com.foresight.core.model.AnalysisSections;
import com.foresight.core.model.AnalysisStage;
import com.foresight.core.model.CapabilityDescriptor;
import com.foresight.core.model.Priority;
import com.foresight.core.model.Recommendation;
import com.foresight.core.model.RecommendationDraft;
import com.foresight.core.model.RelevantCapabilities;
import com.foresight.core.state.AnalysisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns the analysis into pending recommendations for ACTION capabilities.
 * <p>
 * Two nested fan-outs: first one selection call per sub-type group, then one
 * generation call per selected capability. Failures at either level only drop
 * the affected group or capability.
 */
@Component
public class GenerateRecommendationsNode {

    private static final Logger log = LoggerFactory.getLogger(GenerateRecommendationsNode.class);

    static final double SELECTION_TEMPERATURE = 0.3;
    static final double GENERATION_TEMPERATURE = 0.2;
    private static final int MAX_EXAMPLES = 3;

    private static final String SELECTION_PROMPT = """
            You advise an autonomous agent on which of its actions to take next.

            Given the agent's latest analysis and a group of actions of the same type,
            return the exact names of the actions that would be worth recommending now.
            Return an empty list when none fit the analysis.
            Only use names from the list provided.
            Respond with valid JSON matching the schema provided.
            """;

    private static final String GENERATION_PROMPT = """
            You turn an analysis into one concrete, ready-to-run recommendation for a single action.

            - priority: high, medium or low
            - reasoning: why this action makes sense now, citing the analysis
            - confidence: between 0 and 1
            - triggerPhrase: the exact message that would make the agent perform the action,
              with concrete amounts, assets and targets
            - params: the action's parameters as key/value pairs
            - estimatedImpact and estimatedGas: short estimates, or empty when unknown
            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final BoundedFanOut fanOut;
    private final ForesightMetrics metrics;

    public GenerateRecommendationsNode(LlmService llmService, BoundedFanOut fanOut, ForesightMetrics metrics) {
        this.llmService = llmService;
        this.fanOut = fanOut;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(AnalysisState state) {
        var sections = state.sections()
                .orElseThrow(() -> new IllegalStateException("No analysis narrative to recommend from"));
        var recommendations = generate(state.analysisId(), sections, state.classified().actionByType());
        metrics.recordRecommendationsGenerated(recommendations.size());
        log.info("Generated {} recommendation(s)", recommendations.size());
        return Map.of(
                AnalysisState.RECOMMENDATIONS, recommendations,
                AnalysisState.STAGE, AnalysisStage.PERSISTING.name()
        );
    }

    public List<Recommendation> generate(String analysisId, AnalysisSections analysis,
                                         Map<String, List<CapabilityDescriptor>> actionByType) {
        if (actionByType == null || actionByType.isEmpty()) {
            return List.of();
        }
        String narrative = narrative(analysis);

        List<List<Recommendation>> perGroup = fanOut.map(actionByType.entrySet(), entry -> {
            var selected = selectGroup(entry.getKey(), entry.getValue(), narrative);
            return fanOut.map(selected, capability -> recommend(analysisId, capability, narrative)).stream()
                    .filter(Objects::nonNull)
                    .toList();
        });
        return perGroup.stream().flatMap(List::stream).toList();
    }

    private List<CapabilityDescriptor> selectGroup(String subType, List<CapabilityDescriptor> group,
                                                   String narrative) {
        try {
            String userPrompt = """
                    Analysis:
                    %s

                    Action type: %s
                    Available actions:
                    %s
                    """.formatted(narrative, subType, PromptFormat.capabilityList(group));
            var response = llmService.structuredCall(SELECTION_PROMPT, userPrompt,
                    RelevantCapabilities.class, SELECTION_TEMPERATURE);
            var names = new HashSet<>(response.relevantCapabilities());
            return group.stream().filter(c -> names.contains(c.name())).toList();
        } catch (Exception e) {
            log.warn("Selection failed for ACTION group {}: {}", subType, e.getMessage());
            metrics.recordInferenceFailure("select_actions");
            return List.of();
        }
    }

    /**
     * @return the recommendation, or {@code null} when generation failed
     */
    private Recommendation recommend(String analysisId, CapabilityDescriptor capability, String narrative) {
        try {
            String userPrompt = """
                    Analysis:
                    %s

                    Action:
                    %s
                    """.formatted(narrative, PromptFormat.capability(capability, MAX_EXAMPLES));
            var draft = llmService.structuredCall(GENERATION_PROMPT, userPrompt,
                    RecommendationDraft.class, GENERATION_TEMPERATURE);
            if (draft.triggerPhrase() == null || draft.triggerPhrase().isBlank()) {
                log.warn("Recommendation for {} has no trigger phrase, discarding", capability.name());
                metrics.recordInferenceFailure("recommend");
                return null;
            }
            return toRecommendation(analysisId, capability, draft);
        } catch (Exception e) {
            log.warn("Recommendation generation failed for {}: {}", capability.name(), e.getMessage());
            metrics.recordInferenceFailure("recommend");
            return null;
        }
    }

    static Recommendation toRecommendation(String analysisId, CapabilityDescriptor capability,
                                           RecommendationDraft draft) {
        var params = new LinkedHashMap<String, String>();
        for (var param : draft.params()) {
            if (param != null && param.key() != null && !param.key().isBlank() && param.value() != null) {
                params.put(param.key(), param.value());
            }
        }
        String owner = draft.ownerName() != null && !draft.ownerName().isBlank()
                ? draft.ownerName()
                : capability.ownerName();
        return Recommendation.pending(
                UUID.randomUUID().toString(),
                analysisId,
                capability.name(),
                owner,
                Priority.fromValue(draft.priority()),
                draft.reasoning() != null ? draft.reasoning() : "",
                draft.confidence(),
                draft.triggerPhrase().trim(),
                params,
                blankToNull(draft.estimatedImpact()),
                blankToNull(draft.estimatedGas()),
                Instant.now());
    }

    private static String narrative(AnalysisSections analysis) {
        return """
                Overview: %s
                Conditions: %s
                Risk: %s
                Opportunities: %s
                """.formatted(analysis.overview(), analysis.conditions(), analysis.risk(), analysis.opportunities());
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
