package com.foresight.core.graph;

import com.foresight.core.nodes.*;
import com.foresight.core.state.AnalysisState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for one analysis run.
 * <p>
 * Topology:
 * <pre>
 *   START -> classify_capabilities -> collect_context -> select_data -> [routeAfterSelect]
 *         -> execute_data -> release_rooms -> generate_insight
 *         -> generate_insight  (nothing selected)
 *   generate_insight -> generate_recommendations -> persist_analysis -> END
 * </pre>
 * Each node finishes its whole fan-out before the next one starts.
 */
@Component
public class AnalysisGraph {

    private static final Logger log = LoggerFactory.getLogger(AnalysisGraph.class);

    private final CompiledGraph<AnalysisState> compiledGraph;

    public AnalysisGraph(
            ClassifyCapabilitiesNode classifyNode,
            CollectContextNode collectNode,
            SelectDataCapabilitiesNode selectNode,
            ExecuteDataCapabilitiesNode executeNode,
            ReleaseRoomsNode releaseNode,
            GenerateInsightNode insightNode,
            GenerateRecommendationsNode recommendationsNode,
            PersistAnalysisNode persistNode) throws Exception {

        var graph = new StateGraph<>(AnalysisState.SCHEMA, AnalysisState::new)
                .addNode("classify_capabilities", node_async(classifyNode::apply))
                .addNode("collect_context", node_async(collectNode::apply))
                .addNode("select_data", node_async(selectNode::apply))
                .addNode("execute_data", node_async(executeNode::apply))
                .addNode("release_rooms", node_async(releaseNode::apply))
                .addNode("generate_insight", node_async(insightNode::apply))
                .addNode("generate_recommendations", node_async(recommendationsNode::apply))
                .addNode("persist_analysis", node_async(persistNode::apply))
                .addEdge(START, "classify_capabilities")
                .addEdge("classify_capabilities", "collect_context")
                .addEdge("collect_context", "select_data")
                .addConditionalEdges("select_data",
                        edge_async(this::routeAfterSelect),
                        Map.of("execute_data", "execute_data",
                                "generate_insight", "generate_insight"))
                .addEdge("execute_data", "release_rooms")
                .addEdge("release_rooms", "generate_insight")
                .addEdge("generate_insight", "generate_recommendations")
                .addEdge("generate_recommendations", "persist_analysis")
                .addEdge("persist_analysis", END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Analysis graph compiled");
    }

    /**
     * Skips execution and room cleanup when no DATA capability was selected.
     */
    String routeAfterSelect(AnalysisState state) {
        return state.selectedCapabilities().isEmpty() ? "generate_insight" : "execute_data";
    }

    public CompiledGraph<AnalysisState> getCompiledGraph() {
        return compiledGraph;
    }
}
