package com.foresight.core.nodes;

import com.foresight.core.engine.BoundedFanOut;
import com.foresight.core.host.CapabilityResult;
import com.foresight.core.host.InMemoryResultRegistry;
import com.foresight.core.host.LocalHostEnvironment;
import com.foresight.core.host.StubCapability;
import com.foresight.core.host.TestHosts;
import com.foresight.core.llm.LlmEmptyResponseException;
import com.foresight.core.llm.LlmService;
import com.foresight.core.metrics.ForesightMetrics;
import com.foresight.core.model.CapabilityDescriptor;
import com.foresight.core.model.ExecutionResult;
import com.foresight.core.state.AnalysisState;
import com.foresight.core.world.WorldManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Runs {@link ExecuteDataCapabilitiesNode} against an in-process host with a mocked LLM.
 */
class ExecuteDataCapabilitiesNodeTest {

    private ExecutorService executor;
    private LlmService llm;
    private InMemoryResultRegistry registry;
    private SimpleMeterRegistry meters;
    private StubCapability balance;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        llm = mock(LlmService.class);
        registry = new InMemoryResultRegistry();
        meters = new SimpleMeterRegistry();
        balance = new StubCapability("wallet:balance", "Balance",
                t -> CapabilityResult.success("2 ETH", Map.of("eth", "2")));
        when(llm.textCall(anyString(), anyString(), anyDouble())).thenReturn("\"Check my wallet balance\"");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private record Fixture(ExecuteDataCapabilitiesNode node, LocalHostEnvironment host, WorldManager worlds) {}

    private Fixture fixture(StubCapability... capabilities) {
        var host = TestHosts.local(List.of(capabilities), List.of(), registry);
        var worlds = new WorldManager(host, TestHosts.agent("agent-1"));
        worlds.ensureAgentWorld();
        var node = new ExecuteDataCapabilitiesNode(llm, host, registry, worlds,
                new BoundedFanOut(executor, 4), new ForesightMetrics(meters));
        return new Fixture(node, host, worlds);
    }

    @Test
    @DisplayName("successful capability yields its data, dispatched with the unquoted trigger in its own room")
    void successfulExecution() {
        var f = fixture(balance);

        var batch = f.node().execute(List.of(CapabilityDescriptor.of("wallet:balance", "Balance")));

        assertEquals(1, batch.results().size());
        ExecutionResult result = batch.results().get(0);
        assertTrue(result.success());
        assertEquals(Map.of("eth", "2"), result.data());
        assertEquals(List.of("Check my wallet balance"), balance.triggers());
        assertEquals(1, batch.roomIds().size());
        assertTrue(f.host().executionContextExists(batch.roomIds().get(0)));
        verify(llm).textCall(anyString(), contains("wallet:balance"), eq(0.2));
    }

    @Test
    @DisplayName("failures stay isolated to their capability")
    void isolatesFailures() {
        var f = fixture(balance,
                StubCapability.failing("market:price", "rate limited"),
                new StubCapability("silent", "Returns nothing", t -> null));

        var batch = f.node().execute(List.of(
                CapabilityDescriptor.of("wallet:balance", "Balance"),
                CapabilityDescriptor.of("market:price", "Price"),
                CapabilityDescriptor.of("silent", "Nothing"),
                CapabilityDescriptor.of("ghost:lookup", "Not registered")));

        var results = batch.results();
        assertEquals(4, results.size());
        assertTrue(results.get(0).success());
        assertEquals("rate limited", results.get(1).error());
        assertEquals(ExecuteDataCapabilitiesNode.NO_RESULT, results.get(2).error());
        assertEquals("Action ghost:lookup not found in host environment", results.get(3).error());
        assertEquals(4, batch.roomIds().size());
        assertEquals(1.0, meters.find("foresight.capability.executions").tag("result", "success").counter().count());
        assertEquals(3.0, meters.find("foresight.capability.executions").tag("result", "failure").counter().count());
    }

    @Test
    @DisplayName("a failed trigger generation opens no room and skips the dispatch")
    void triggerFailure() {
        var flaky = StubCapability.succeeding("flaky", "never called");
        when(llm.textCall(anyString(), contains("Name: flaky\n"), anyDouble()))
                .thenThrow(new LlmEmptyResponseException("empty"));
        var f = fixture(balance, flaky);

        var batch = f.node().execute(List.of(
                CapabilityDescriptor.of("wallet:balance", "Balance"),
                CapabilityDescriptor.of("flaky", "Flaky")));

        assertTrue(batch.results().get(0).success());
        assertFalse(batch.results().get(1).success());
        assertEquals("empty", batch.results().get(1).error());
        assertEquals(1, batch.roomIds().size());
        assertTrue(flaky.triggers().isEmpty());
    }

    @Test
    @DisplayName("nothing selected means no inference, no host calls and no rooms")
    void emptySelection() {
        var host = mock(com.foresight.core.host.HostEnvironment.class);
        var worlds = mock(WorldManager.class);
        var node = new ExecuteDataCapabilitiesNode(llm, host, registry, worlds,
                new BoundedFanOut(executor, 4), new ForesightMetrics(meters));

        var batch = node.execute(List.of());

        assertTrue(batch.results().isEmpty());
        assertTrue(batch.roomIds().isEmpty());
        verifyNoInteractions(host, worlds);
        verify(llm, never()).textCall(anyString(), anyString(), anyDouble());
    }

    @Test
    @DisplayName("release_rooms deletes the rooms but keeps the agent world")
    void releaseRooms() {
        var f = fixture(balance);
        var batch = f.node().execute(List.of(CapabilityDescriptor.of("wallet:balance", "Balance")));

        new ReleaseRoomsNode(f.worlds()).apply(new AnalysisState(Map.of(AnalysisState.EXECUTION, batch)));

        assertFalse(f.host().executionContextExists(batch.roomIds().get(0)));
        assertTrue(f.host().executionContextExists(f.worlds().agentWorldId()));
    }

    @Test
    @DisplayName("result mapping falls back to text, then to a generic error")
    void resultMapping() {
        var textOnly = ExecuteDataCapabilitiesNode.toExecutionResult("x", CapabilityResult.success("plain", null));
        assertEquals("plain", textOnly.data());

        var noError = ExecuteDataCapabilitiesNode.toExecutionResult("x",
                new CapabilityResult(false, "insufficient funds", null, null));
        assertEquals("insufficient funds", noError.error());

        assertEquals("Action failed", ExecuteDataCapabilitiesNode.toExecutionResult("x",
                new CapabilityResult(false, null, null, " ")).error());
    }

    @Test
    @DisplayName("surrounding quotes are stripped from trigger phrases")
    void stripQuotes() {
        assertEquals("Check balance", ExecuteDataCapabilitiesNode.stripQuotes("  \"Check balance\" "));
        assertEquals("Say \"hi\" now", ExecuteDataCapabilitiesNode.stripQuotes("Say \"hi\" now"));
        assertEquals("\"", ExecuteDataCapabilitiesNode.stripQuotes("\""));
    }
}
