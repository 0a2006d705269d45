package com.foresight.core.nodes;

import com.foresight.core.engine.BoundedFanOut;
import com.foresight.core.host.CapabilityResult;
import com.foresight.core.host.HostEnvironment;
import com.foresight.core.host.ResultRegistry;
import com.foresight.core.llm.LlmService;
import com.foresight.core.logging.MdcContext;
import com.foresight.core.metrics.ForesightMetrics;
import com.foresight.core.model.AnalysisStage;
import com.foresight.core.model.CapabilityDescriptor;
import com.foresight.core.model.DataExecutionBatch;
import com.foresight.core.model.ExecutionResult;
import com.foresight.core.state.AnalysisState;
import com.foresight.core.world.WorldManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the selected DATA capabilities concurrently.
 * <p>
 * Each capability gets a generated trigger phrase, its own room inside the agent's
 * world and a fresh correlation id; its result is read back from the
 * {@link ResultRegistry}. Any failure along the way becomes a failed
 * {@link ExecutionResult} for that capability only.
 */
@Component
public class ExecuteDataCapabilitiesNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteDataCapabilitiesNode.class);

    static final double TEMPERATURE = 0.2;
    static final String NO_RESULT = "No result returned from action";
    private static final int MAX_EXAMPLES = 3;

    private static final String SYSTEM_PROMPT = """
            You write the single message an agent would send to itself to trigger one of its
            data capabilities. Write it as a natural, specific request in one sentence.
            Reply with the message text only, without quotes or explanation.
            """;

    private final LlmService llmService;
    private final HostEnvironment host;
    private final ResultRegistry registry;
    private final WorldManager worldManager;
    private final BoundedFanOut fanOut;
    private final ForesightMetrics metrics;

    public ExecuteDataCapabilitiesNode(LlmService llmService, HostEnvironment host, ResultRegistry registry,
                                       WorldManager worldManager, BoundedFanOut fanOut, ForesightMetrics metrics) {
        this.llmService = llmService;
        this.host = host;
        this.registry = registry;
        this.worldManager = worldManager;
        this.fanOut = fanOut;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(AnalysisState state) {
        var batch = execute(state.selectedCapabilities());
        long succeeded = batch.results().stream().filter(ExecutionResult::success).count();
        log.info("Executed {} DATA capabilities ({} succeeded)", batch.results().size(), succeeded);
        return Map.of(
                AnalysisState.EXECUTION, batch,
                AnalysisState.STAGE, AnalysisStage.RELEASING_ROOMS.name()
        );
    }

    public DataExecutionBatch execute(List<CapabilityDescriptor> capabilities) {
        if (capabilities == null || capabilities.isEmpty()) {
            return DataExecutionBatch.empty();
        }
        List<Attempt> attempts = fanOut.map(capabilities, this::executeOne);

        var results = new ArrayList<ExecutionResult>(attempts.size());
        var roomIds = new ArrayList<String>();
        for (var attempt : attempts) {
            results.add(attempt.result());
            if (attempt.roomId() != null) {
                roomIds.add(attempt.roomId());
            }
        }
        return new DataExecutionBatch(results, roomIds);
    }

    private Attempt executeOne(CapabilityDescriptor capability) {
        MdcContext.setCapability(capability.name());
        String roomId = null;
        try {
            String trigger = generateTrigger(capability);
            roomId = worldManager.openRoom();
            String correlationId = UUID.randomUUID().toString();
            log.debug("Dispatching {} in room {} with trigger \"{}\"", capability.name(), roomId, trigger);
            host.dispatch(correlationId, trigger, capability.name());

            var result = toExecutionResult(capability.name(), lookup(correlationId));
            metrics.recordCapabilityExecution(result.success());
            return new Attempt(result, roomId);
        } catch (Exception e) {
            log.warn("Execution of {} failed: {}", capability.name(), e.getMessage());
            metrics.recordCapabilityExecution(false);
            return new Attempt(ExecutionResult.failed(capability.name(), messageOf(e)), roomId);
        }
    }

    private String generateTrigger(CapabilityDescriptor capability) {
        String phrase = llmService.textCall(SYSTEM_PROMPT,
                "Write a trigger message for this capability:\n\n" + PromptFormat.capability(capability, MAX_EXAMPLES),
                TEMPERATURE);
        return stripQuotes(phrase);
    }

    private CapabilityResult lookup(String correlationId) {
        try {
            return registry.get(correlationId).orElse(null);
        } finally {
            registry.remove(correlationId);
        }
    }

    static ExecutionResult toExecutionResult(String capabilityName, CapabilityResult result) {
        if (result == null) {
            return ExecutionResult.failed(capabilityName, NO_RESULT);
        }
        if (result.success()) {
            Object data = result.data() != null ? result.data() : result.text();
            return ExecutionResult.succeeded(capabilityName, data);
        }
        String error = result.error() != null && !result.error().isBlank()
                ? result.error()
                : (result.text() != null && !result.text().isBlank() ? result.text() : "Action failed");
        return ExecutionResult.failed(capabilityName, error);
    }

    static String stripQuotes(String phrase) {
        String trimmed = phrase.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record Attempt(ExecutionResult result, String roomId) {}
}
