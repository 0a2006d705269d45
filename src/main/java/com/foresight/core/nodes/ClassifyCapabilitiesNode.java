package com.foresight.core.nodes;

import com.foresight.core.engine.BoundedFanOut;
import com.foresight.core.host.HostEnvironment;
import com.foresight.core.llm.LlmService;
import com.foresight.core.metrics.ForesightMetrics;
import com.foresight.core.model.AnalysisStage;
import com.foresight.core.model.CapabilityCategory;
import com.foresight.core.model.CapabilityClassification;
import com.foresight.core.model.CapabilityClassificationResponse;
import com.foresight.core.model.CapabilityDescriptor;
import com.foresight.core.model.ClassifiedCapabilities;
import com.foresight.core.state.AnalysisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Labels every host capability as DATA or ACTION with a sub-type, one inference
 * call per capability, and groups the results by sub-type.
 * <p>
 * A capability whose call fails, or whose answer names no known category, is
 * dropped from this run.
 */
@Component
public class ClassifyCapabilitiesNode {

    private static final Logger log = LoggerFactory.getLogger(ClassifyCapabilitiesNode.class);

    static final double TEMPERATURE = 0.1;
    private static final int MAX_EXAMPLES = 2;

    private static final String SYSTEM_PROMPT = """
            You classify the capabilities of an autonomous agent.

            Categories:
            - DATA: read-only operations that fetch or analyse information without changing any state.
            - ACTION: operations that change state, move funds, publish content or otherwise have side effects.

            DATA sub-types: GET_BALANCE, GET_PRICE, GET_PORTFOLIO, GET_TRANSACTIONS, GET_NFT,
            GET_MARKET_DATA, SEARCH, ANALYZE, READ, OTHER.

            ACTION sub-types: SWAP, TRANSFER, STAKE, UNSTAKE, BRIDGE, NFT_MINT, NFT_TRANSFER,
            LIQUIDITY_ADD, LIQUIDITY_REMOVE, GOVERNANCE_VOTE, SOCIAL_POST, OTHER.

            Pick the sub-type from the chosen category's list. Use OTHER when nothing fits.
            When unsure whether something mutates state, prefer ACTION.
            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final HostEnvironment host;
    private final BoundedFanOut fanOut;
    private final ForesightMetrics metrics;

    public ClassifyCapabilitiesNode(LlmService llmService, HostEnvironment host,
                                    BoundedFanOut fanOut, ForesightMetrics metrics) {
        this.llmService = llmService;
        this.host = host;
        this.fanOut = fanOut;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(AnalysisState state) {
        var capabilities = host.capabilities();
        log.info("Classifying {} capabilities", capabilities.size());
        var classified = classify(capabilities);
        log.info("Classified {} DATA and {} ACTION capabilities ({} dropped)",
                classified.dataCount(), classified.actionCount(),
                capabilities.size() - classified.classifications().size());
        return Map.of(
                AnalysisState.CLASSIFIED, classified,
                AnalysisState.STAGE, AnalysisStage.COLLECTING_CONTEXT.name()
        );
    }

    public ClassifiedCapabilities classify(List<CapabilityDescriptor> capabilities) {
        if (capabilities == null || capabilities.isEmpty()) {
            return ClassifiedCapabilities.empty();
        }

        List<Optional<Labelled>> outcomes = fanOut.map(capabilities, this::classifyOne);

        var dataByType = new LinkedHashMap<String, List<CapabilityDescriptor>>();
        var actionByType = new LinkedHashMap<String, List<CapabilityDescriptor>>();
        var classifications = new ArrayList<CapabilityClassification>();
        for (var outcome : outcomes) {
            if (outcome.isEmpty()) continue;
            var labelled = outcome.get();
            var target = labelled.classification().category() == CapabilityCategory.DATA ? dataByType : actionByType;
            target.computeIfAbsent(labelled.classification().subType(), k -> new ArrayList<>())
                    .add(labelled.capability());
            classifications.add(labelled.classification());
        }
        return new ClassifiedCapabilities(dataByType, actionByType, classifications);
    }

    private Optional<Labelled> classifyOne(CapabilityDescriptor capability) {
        try {
            var response = llmService.structuredCall(SYSTEM_PROMPT,
                    "Classify this capability:\n\n" + PromptFormat.capability(capability, MAX_EXAMPLES),
                    CapabilityClassificationResponse.class, TEMPERATURE);
            var category = parseCategory(response.category());
            if (category.isEmpty()) {
                log.warn("Capability {} classified with unknown category '{}', skipping",
                        capability.name(), response.category());
                metrics.recordInferenceFailure("classify");
                return Optional.empty();
            }
            return Optional.of(new Labelled(capability, new CapabilityClassification(
                    capability.name(), category.get(), response.subType(), response.confidence(),
                    response.reasoning(), capability.ownerName())));
        } catch (Exception e) {
            log.warn("Failed to classify capability {}: {}", capability.name(), e.getMessage());
            metrics.recordInferenceFailure("classify");
            return Optional.empty();
        }
    }

    private static Optional<CapabilityCategory> parseCategory(String raw) {
        if (raw == null) return Optional.empty();
        for (var category : CapabilityCategory.values()) {
            if (category.name().equalsIgnoreCase(raw.trim())) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    private record Labelled(CapabilityDescriptor capability, CapabilityClassification classification) {}
}
