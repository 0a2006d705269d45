package com.foresight.core.world;

import com.foresight.core.host.HostEnvironment;
import com.foresight.core.host.InMemoryResultRegistry;
import com.foresight.core.host.TestHosts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WorldManagerTest {

    @Test
    @DisplayName("world id is a stable function of the agent id")
    void deterministicWorldId() {
        assertEquals(WorldManager.worldIdFor("agent-1"), WorldManager.worldIdFor("agent-1"));
        assertNotEquals(WorldManager.worldIdFor("agent-1"), WorldManager.worldIdFor("agent-2"));

        var manager = new WorldManager(mock(HostEnvironment.class), TestHosts.agent("agent-1"));
        assertEquals(WorldManager.worldIdFor("agent-1"), manager.agentWorldId());
    }

    @Test
    @DisplayName("ensureAgentWorld creates the world once")
    void ensureAgentWorldIdempotent() {
        var host = TestHosts.local(List.of(), List.of(), new InMemoryResultRegistry());
        var manager = new WorldManager(host, TestHosts.agent("agent-1"));

        String first = manager.ensureAgentWorld();
        String second = manager.ensureAgentWorld();

        assertEquals(first, second);
        assertTrue(host.executionContextExists(first));
    }

    @Test
    @DisplayName("rooms are distinct and live inside the agent world")
    void openRoom() {
        var host = TestHosts.local(List.of(), List.of(), new InMemoryResultRegistry());
        var manager = new WorldManager(host, TestHosts.agent("agent-1"));

        String a = manager.openRoom();
        String b = manager.openRoom();

        assertNotEquals(a, b);
        assertTrue(host.executionContextExists(a));
        host.deleteExecutionContext(manager.agentWorldId());
        assertFalse(host.executionContextExists(a));
        assertFalse(host.executionContextExists(b));
    }

    @Test
    @DisplayName("cleanup keeps going past rooms that cannot be deleted")
    void cleanupIsolatesFailures() {
        var host = mock(HostEnvironment.class);
        doThrow(new IllegalArgumentException("gone")).when(host).deleteExecutionContext("room-1");
        var manager = new WorldManager(host, TestHosts.agent("agent-1"));

        assertDoesNotThrow(() -> manager.cleanup(List.of("room-1", "room-2")));

        verify(host).deleteExecutionContext("room-2");
    }

    @Test
    @DisplayName("host errors while creating the world propagate")
    void ensureAgentWorldPropagates() {
        var host = mock(HostEnvironment.class);
        when(host.executionContextExists(anyString())).thenReturn(false);
        doThrow(new IllegalStateException("host offline")).when(host).ensureExecutionContext(anyString(), isNull());
        var manager = new WorldManager(host, TestHosts.agent("agent-1"));

        assertThrows(IllegalStateException.class, manager::ensureAgentWorld);
    }
}
