package com.foresight.core.graph;

import com.foresight.core.model.Analysis;
import com.foresight.core.model.AnalysisSections;
import com.foresight.core.model.AnalysisStage;
import com.foresight.core.model.CapabilityDescriptor;
import com.foresight.core.nodes.*;
import com.foresight.core.state.AnalysisState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Topology of the analysis graph, run with every node mocked.
 */
class AnalysisGraphTest {

    private ClassifyCapabilitiesNode classify;
    private CollectContextNode collect;
    private SelectDataCapabilitiesNode select;
    private ExecuteDataCapabilitiesNode execute;
    private ReleaseRoomsNode release;
    private GenerateInsightNode insight;
    private GenerateRecommendationsNode recommend;
    private PersistAnalysisNode persist;

    private AnalysisGraph analysisGraph;

    @BeforeEach
    void setUp() throws Exception {
        classify = mock(ClassifyCapabilitiesNode.class);
        collect = mock(CollectContextNode.class);
        select = mock(SelectDataCapabilitiesNode.class);
        execute = mock(ExecuteDataCapabilitiesNode.class);
        release = mock(ReleaseRoomsNode.class);
        insight = mock(GenerateInsightNode.class);
        recommend = mock(GenerateRecommendationsNode.class);
        persist = mock(PersistAnalysisNode.class);

        when(classify.apply(any(AnalysisState.class)))
                .thenReturn(Map.of(AnalysisState.STAGE, AnalysisStage.COLLECTING_CONTEXT.name()));
        when(collect.apply(any(AnalysisState.class)))
                .thenReturn(Map.of(AnalysisState.STAGE, AnalysisStage.SELECTING.name()));
        when(execute.apply(any(AnalysisState.class)))
                .thenReturn(Map.of(AnalysisState.STAGE, AnalysisStage.RELEASING_ROOMS.name()));
        when(release.apply(any(AnalysisState.class)))
                .thenReturn(Map.of(AnalysisState.STAGE, AnalysisStage.SYNTHESIZING.name()));
        when(insight.apply(any(AnalysisState.class))).thenReturn(Map.of(
                AnalysisState.STAGE, AnalysisStage.RECOMMENDING.name(),
                AnalysisState.SECTIONS, new AnalysisSections("o", "c", "r", "p")));
        when(recommend.apply(any(AnalysisState.class)))
                .thenReturn(Map.of(AnalysisState.STAGE, AnalysisStage.PERSISTING.name()));
        when(persist.apply(any(AnalysisState.class))).thenAnswer(invocation -> {
            AnalysisState state = invocation.getArgument(0);
            var analysis = new Analysis(state.analysisId(), state.agentId(), Instant.now(),
                    state.sections().orElseThrow(), List.of(), 5);
            return Map.of(AnalysisState.STAGE, AnalysisStage.COMPLETED.name(), AnalysisState.ANALYSIS, analysis);
        });

        analysisGraph = new AnalysisGraph(classify, collect, select, execute, release, insight, recommend, persist);
    }

    private AnalysisState run() throws Exception {
        return analysisGraph.getCompiledGraph().invoke(Map.of(
                AnalysisState.ANALYSIS_ID, "a-1",
                AnalysisState.AGENT_ID, "agent-1")).orElseThrow();
    }

    @Test
    @DisplayName("Graph compiles without errors")
    void graphCompiles() {
        assertNotNull(analysisGraph.getCompiledGraph());
    }

    @Test
    @DisplayName("Selected capabilities route through execution and room release")
    void runsExecutionWhenSelected() throws Exception {
        when(select.apply(any(AnalysisState.class))).thenReturn(Map.of(
                AnalysisState.STAGE, AnalysisStage.EXECUTING.name(),
                AnalysisState.SELECTED, List.of(CapabilityDescriptor.of("wallet:balance", "Balance"))));

        var state = run();

        assertEquals(AnalysisStage.COMPLETED, state.stage());
        assertEquals("a-1", state.analysis().orElseThrow().id());
        var order = inOrder(classify, collect, select, execute, release, insight, recommend, persist);
        order.verify(classify).apply(any(AnalysisState.class));
        order.verify(collect).apply(any(AnalysisState.class));
        order.verify(select).apply(any(AnalysisState.class));
        order.verify(execute).apply(any(AnalysisState.class));
        order.verify(release).apply(any(AnalysisState.class));
        order.verify(insight).apply(any(AnalysisState.class));
        order.verify(recommend).apply(any(AnalysisState.class));
        order.verify(persist).apply(any(AnalysisState.class));
    }

    @Test
    @DisplayName("Empty selection goes straight to insight generation")
    void skipsExecutionWhenNothingSelected() throws Exception {
        when(select.apply(any(AnalysisState.class)))
                .thenReturn(Map.of(AnalysisState.STAGE, AnalysisStage.SYNTHESIZING.name()));

        var state = run();

        assertEquals(AnalysisStage.COMPLETED, state.stage());
        verify(execute, never()).apply(any(AnalysisState.class));
        verify(release, never()).apply(any(AnalysisState.class));
        verify(insight).apply(any(AnalysisState.class));
    }

    @Test
    @DisplayName("routeAfterSelect picks the branch from the selection")
    void routeAfterSelect() {
        var empty = new AnalysisState(Map.of());
        var selected = new AnalysisState(Map.of(AnalysisState.SELECTED,
                List.of(CapabilityDescriptor.of("wallet:balance", "Balance"))));

        assertEquals("generate_insight", analysisGraph.routeAfterSelect(empty));
        assertEquals("execute_data", analysisGraph.routeAfterSelect(selected));
    }

    @Test
    @DisplayName("A failing node aborts the run before persistence")
    void failingNodeAborts() {
        when(select.apply(any(AnalysisState.class))).thenReturn(Map.of(
                AnalysisState.STAGE, AnalysisStage.EXECUTING.name(),
                AnalysisState.SELECTED, List.of(CapabilityDescriptor.of("wallet:balance", "Balance"))));
        when(insight.apply(any(AnalysisState.class))).thenThrow(new IllegalStateException("model unavailable"));

        assertThrows(Exception.class, this::run);
        verify(persist, never()).apply(any(AnalysisState.class));
    }
}
