package com.foresight.core.world;

import com.foresight.core.host.AgentProperties;
import com.foresight.core.host.HostEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Owns the agent's durable world and the short-lived rooms opened inside it.
 * <p>
 * The world id is derived from the agent id, so every process for the same agent
 * converges on the same world.
 */
@Service
public class WorldManager {

    private static final Logger log = LoggerFactory.getLogger(WorldManager.class);

    private final HostEnvironment host;
    private final AgentProperties agent;

    public WorldManager(HostEnvironment host, AgentProperties agent) {
        this.host = host;
        this.agent = agent;
    }

    public String agentWorldId() {
        return worldIdFor(agent.getId());
    }

    public static String worldIdFor(String agentId) {
        return UUID.nameUUIDFromBytes(("foresight-agent-" + agentId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Creates the agent's world if it does not exist yet. Host errors propagate.
     *
     * @return the world id
     */
    public String ensureAgentWorld() {
        String worldId = agentWorldId();
        if (!host.executionContextExists(worldId)) {
            host.ensureExecutionContext(worldId, null);
            log.info("Created world {} for agent {}", worldId, agent.getId());
        }
        return worldId;
    }

    /**
     * Opens a fresh room inside the agent's world.
     */
    public String openRoom() {
        String roomId = UUID.randomUUID().toString();
        host.ensureExecutionContext(roomId, ensureAgentWorld());
        return roomId;
    }

    /**
     * Deletes the given rooms. Failures are logged per room and never propagate.
     */
    public void cleanup(List<String> roomIds) {
        if (roomIds == null || roomIds.isEmpty()) {
            return;
        }
        int removed = 0;
        for (String roomId : roomIds) {
            try {
                host.deleteExecutionContext(roomId);
                removed++;
            } catch (Exception e) {
                log.warn("Failed to clean up room {}: {}", roomId, e.getMessage());
            }
        }
        log.debug("Cleaned up {}/{} rooms", removed, roomIds.size());
    }
}
