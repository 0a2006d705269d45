package com.foresight.core.nodes;

import com.foresight.core.engine.BoundedFanOut;
import com.foresight.core.host.HostEnvironment;
import com.foresight.core.llm.LlmParseException;
import com.foresight.core.llm.LlmService;
import com.foresight.core.metrics.ForesightMetrics;
import com.foresight.core.model.AnalysisStage;
import com.foresight.core.model.CapabilityCategory;
import com.foresight.core.model.CapabilityClassificationResponse;
import com.foresight.core.model.CapabilityDescriptor;
import com.foresight.core.model.ClassifiedCapabilities;
import com.foresight.core.state.AnalysisState;
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
 * Unit tests for {@link ClassifyCapabilitiesNode}.
 */
class ClassifyCapabilitiesNodeTest {

    private ExecutorService executor;
    private LlmService llm;
    private HostEnvironment host;
    private SimpleMeterRegistry registry;
    private ClassifyCapabilitiesNode node;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        llm = mock(LlmService.class);
        host = mock(HostEnvironment.class);
        registry = new SimpleMeterRegistry();
        node = new ClassifyCapabilitiesNode(llm, host, new BoundedFanOut(executor, 4), new ForesightMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void classifyAs(String name, String category, String subType) {
        when(llm.structuredCall(anyString(), contains("Name: " + name + "\n"),
                eq(CapabilityClassificationResponse.class), anyDouble()))
                .thenReturn(new CapabilityClassificationResponse(category, subType, 0.9, "because"));
    }

    @Test
    @DisplayName("groups capabilities by category and sub-type and drops failures")
    void groupsAndDropsFailures() {
        classifyAs("wallet:balance", "DATA", "GET_BALANCE");
        classifyAs("defi:swap", "ACTION", "SWAP");
        when(llm.structuredCall(anyString(), contains("Name: broken\n"),
                eq(CapabilityClassificationResponse.class), anyDouble()))
                .thenThrow(new LlmParseException("not json"));

        ClassifiedCapabilities result = node.classify(List.of(
                CapabilityDescriptor.of("wallet:balance", "Returns the wallet balance"),
                CapabilityDescriptor.of("defi:swap", "Swaps tokens"),
                CapabilityDescriptor.of("broken", "Something")));

        assertEquals(List.of("wallet:balance"),
                result.dataByType().get("GET_BALANCE").stream().map(CapabilityDescriptor::name).toList());
        assertEquals(List.of("defi:swap"),
                result.actionByType().get("SWAP").stream().map(CapabilityDescriptor::name).toList());
        assertEquals(2, result.classifications().size());
        assertEquals(1, result.dataCount());
        assertEquals(1, result.actionCount());
        assertEquals(1.0, registry.find("foresight.inference.failures").tag("stage", "classify").counter().count());
    }

    @Test
    @DisplayName("an unknown category drops the capability; a blank sub-type becomes OTHER")
    void unknownCategoryAndBlankSubType() {
        classifyAs("social:post", "MUTATION", "SOCIAL_POST");
        classifyAs("wallet:history", "data", "");

        var result = node.classify(List.of(
                CapabilityDescriptor.of("social:post", "Posts"),
                CapabilityDescriptor.of("wallet:history", "History")));

        assertTrue(result.actionByType().isEmpty());
        assertEquals(1, result.dataByType().get("OTHER").size());
        assertEquals(CapabilityCategory.DATA, result.classifications().get(0).category());
        assertEquals("wallet", result.classifications().get(0).ownerName());
    }

    @Test
    @DisplayName("classification runs at temperature 0.1 and shows the sub-type vocabularies")
    void usesLowTemperatureAndVocabulary() {
        classifyAs("wallet:balance", "DATA", "GET_BALANCE");

        node.classify(List.of(CapabilityDescriptor.of("wallet:balance", "Balance")));

        verify(llm).structuredCall(
                argThat(system -> system.contains("GET_BALANCE") && system.contains("LIQUIDITY_ADD")),
                anyString(), eq(CapabilityClassificationResponse.class), eq(0.1));
    }

    @Test
    @DisplayName("apply reads the host capabilities and advances to COLLECTING_CONTEXT")
    void applyUsesHostCapabilities() {
        when(host.capabilities()).thenReturn(List.of(CapabilityDescriptor.of("wallet:balance", "Balance")));
        classifyAs("wallet:balance", "DATA", "GET_BALANCE");

        Map<String, Object> update = node.apply(new AnalysisState(Map.of()));

        var classified = (ClassifiedCapabilities) update.get(AnalysisState.CLASSIFIED);
        assertEquals(1, classified.dataCount());
        assertEquals(AnalysisStage.COLLECTING_CONTEXT.name(), update.get(AnalysisState.STAGE));
    }

    @Test
    @DisplayName("no capabilities means no inference calls")
    void emptyCapabilities() {
        var result = node.classify(List.of());

        assertEquals(0, result.dataCount() + result.actionCount());
        verifyNoInteractions(llm);
    }
}
