package com.foresight.core.nodes;

import com.foresight.core.llm.LlmService;
import com.foresight.core.model.AnalysisSections;
import com.foresight.core.model.AnalysisStage;
import com.foresight.core.model.CapabilityDescriptor;
import com.foresight.core.model.ContextSnapshot;
import com.foresight.core.model.ExecutionResult;
import com.foresight.core.state.AnalysisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the four-section narrative from the execution results and context.
 * A failed inference call aborts the run.
 */
@Component
public class GenerateInsightNode {

    private static final Logger log = LoggerFactory.getLogger(GenerateInsightNode.class);

    static final double TEMPERATURE = 0.7;

    private static final String SYSTEM_PROMPT = """
            You are the analyst of an autonomous agent. From the data the agent just gathered
            and its current context, write a concise analysis in four sections:
            - overview: the agent's current position, holdings and recent activity
            - conditions: relevant market and environmental conditions
            - risk: exposures, concentration and anything that could go wrong
            - opportunities: concrete opportunities worth acting on
            Ground every statement in the data provided. Mention failed lookups only when
            the missing data matters. Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;

    public GenerateInsightNode(LlmService llmService) {
        this.llmService = llmService;
    }

    public Map<String, Object> apply(AnalysisState state) {
        var results = state.execution().results();
        var context = state.context();
        var sections = generate(results, context);
        var used = capabilitiesUsed(results, context);
        log.info("Analysis narrative generated from {} result(s), {} contributor(s)", results.size(), used.size());
        return Map.of(
                AnalysisState.SECTIONS, sections,
                AnalysisState.CAPABILITIES_USED, used,
                AnalysisState.STAGE, AnalysisStage.RECOMMENDING.name()
        );
    }

    public AnalysisSections generate(List<ExecutionResult> results, List<ContextSnapshot> context) {
        String userPrompt = """
                Data gathered:
                %s

                Context:
                %s
                """.formatted(formatResults(results), PromptFormat.context(context));
        return llmService.structuredCall(SYSTEM_PROMPT, userPrompt, AnalysisSections.class, TEMPERATURE);
    }

    /**
     * Owners of the successful results (the name prefix before ':') followed by the
     * context providers, in first-seen order without duplicates.
     */
    public static List<String> capabilitiesUsed(List<ExecutionResult> results, List<ContextSnapshot> context) {
        var used = new LinkedHashSet<String>();
        results.stream()
                .filter(ExecutionResult::success)
                .map(r -> owner(r.capabilityName()))
                .forEach(used::add);
        context.forEach(s -> used.add(s.providerName()));
        return new ArrayList<>(used);
    }

    private static String owner(String capabilityName) {
        String prefix = CapabilityDescriptor.ownerPrefix(capabilityName);
        return "unknown".equals(prefix) ? capabilityName : prefix;
    }

    private static String formatResults(List<ExecutionResult> results) {
        if (results.isEmpty()) {
            return "(no data capabilities were run)";
        }
        return results.stream()
                .map(r -> r.success()
                        ? "[" + r.capabilityName() + "] SUCCESS\n" + PromptFormat.json(r.data())
                        : "[" + r.capabilityName() + "] FAILED: " + r.error())
                .collect(Collectors.joining("\n\n"));
    }
}
