package com.foresight.core.nodes;

import com.foresight.core.host.HostEnvironment;
import com.foresight.core.model.AnalysisStage;
import com.foresight.core.model.ContextSnapshot;
import com.foresight.core.state.AnalysisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Gathers one snapshot per context provider through a single host call.
 */
@Component
public class CollectContextNode {

    private static final Logger log = LoggerFactory.getLogger(CollectContextNode.class);

    private final HostEnvironment host;

    public CollectContextNode(HostEnvironment host) {
        this.host = host;
    }

    public Map<String, Object> apply(AnalysisState state) {
        var snapshots = collect();
        log.info("Collected context from {} provider(s)", snapshots.size());
        return Map.of(
                AnalysisState.CONTEXT, snapshots,
                AnalysisState.STAGE, AnalysisStage.SELECTING.name()
        );
    }

    public List<ContextSnapshot> collect() {
        Instant collectedAt = Instant.now();
        return host.composeContext().entrySet().stream()
                .map(e -> new ContextSnapshot(e.getKey(), e.getValue(), collectedAt))
                .toList();
    }
}
