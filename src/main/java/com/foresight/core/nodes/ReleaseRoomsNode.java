package com.foresight.core.nodes;

import com.foresight.core.model.AnalysisStage;
import com.foresight.core.state.AnalysisState;
import com.foresight.core.world.WorldManager;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Deletes the rooms opened while executing DATA capabilities.
 */
@Component
public class ReleaseRoomsNode {

    private final WorldManager worldManager;

    public ReleaseRoomsNode(WorldManager worldManager) {
        this.worldManager = worldManager;
    }

    public Map<String, Object> apply(AnalysisState state) {
        worldManager.cleanup(state.execution().roomIds());
        return Map.of(AnalysisState.STAGE, AnalysisStage.SYNTHESIZING.name());
    }
}
