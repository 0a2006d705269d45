package com.foresight.core.nodes;

import com.foresight.core.engine.BoundedFanOut;
import com.foresight.core.llm.LlmService;
import com.foresight.core.metrics.ForesightMetrics;
import com.foresight.core.model.AnalysisStage;
import com.foresight.core.model.CapabilityDescriptor;
import com.foresight.core.model.ContextSnapshot;
import com.foresight.core.model.RelevantCapabilities;
import com.foresight.core.state.AnalysisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Picks the DATA capabilities worth running given the current context,
 * one inference call per sub-type group. A failing group selects nothing.
 */
@Component
public class SelectDataCapabilitiesNode {

    private static final Logger log = LoggerFactory.getLogger(SelectDataCapabilitiesNode.class);

    static final double TEMPERATURE = 0.3;

    private static final String SYSTEM_PROMPT = """
            You decide which read-only data capabilities an autonomous agent should run
            to understand its current situation.

            Given the agent's context and a group of capabilities of the same type, return
            the exact names of the capabilities that would produce useful, non-redundant
            information right now. Return an empty list when none are useful.
            Only use names from the list provided.
            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final BoundedFanOut fanOut;
    private final ForesightMetrics metrics;

    public SelectDataCapabilitiesNode(LlmService llmService, BoundedFanOut fanOut, ForesightMetrics metrics) {
        this.llmService = llmService;
        this.fanOut = fanOut;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(AnalysisState state) {
        var selected = select(state.classified().dataByType(), state.context());
        log.info("Selected {} DATA capabilities: {}", selected.size(),
                selected.stream().map(CapabilityDescriptor::name).toList());
        return Map.of(
                AnalysisState.SELECTED, selected,
                AnalysisState.STAGE, AnalysisStage.EXECUTING.name()
        );
    }

    public List<CapabilityDescriptor> select(Map<String, List<CapabilityDescriptor>> dataByType,
                                             List<ContextSnapshot> context) {
        if (dataByType == null || dataByType.isEmpty()) {
            return List.of();
        }
        String contextText = PromptFormat.context(context);
        List<List<CapabilityDescriptor>> perGroup = fanOut.map(dataByType.entrySet(),
                entry -> selectGroup(entry.getKey(), entry.getValue(), contextText));
        return perGroup.stream().flatMap(List::stream).toList();
    }

    private List<CapabilityDescriptor> selectGroup(String subType, List<CapabilityDescriptor> group,
                                                   String contextText) {
        try {
            String userPrompt = """
                    Agent context:
                    %s

                    Capability type: %s
                    Available capabilities:
                    %s
                    """.formatted(contextText, subType, PromptFormat.capabilityList(group));
            var response = llmService.structuredCall(SYSTEM_PROMPT, userPrompt,
                    RelevantCapabilities.class, TEMPERATURE);
            var names = new HashSet<>(response.relevantCapabilities());
            var chosen = group.stream().filter(c -> names.contains(c.name())).toList();
            log.debug("Group {} → {}/{} selected", subType, chosen.size(), group.size());
            return chosen;
        } catch (Exception e) {
            log.warn("Selection failed for DATA group {}: {}", subType, e.getMessage());
            metrics.recordInferenceFailure("select_data");
            return List.of();
        }
    }
}
