package com.foresight.core.state;

import com.foresight.core.model.*;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one analysis run.
 * <p>
 * Every stage writes whole values; nothing accumulates across nodes, so all
 * channels use last-write-wins semantics.
 */
public class AnalysisState extends AgentState {

    public static final String AGENT_ID = "agentId";
    public static final String ANALYSIS_ID = "analysisId";
    public static final String STARTED_AT = "startedAt";
    public static final String STAGE = "stage";
    public static final String CLASSIFIED = "classified";
    public static final String CONTEXT = "context";
    public static final String SELECTED = "selectedCapabilities";
    public static final String EXECUTION = "execution";
    public static final String SECTIONS = "sections";
    public static final String CAPABILITIES_USED = "capabilitiesUsed";
    public static final String RECOMMENDATIONS = "recommendations";
    public static final String ANALYSIS = "analysis";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry(AGENT_ID,          Channels.base(() -> "")),
        Map.entry(ANALYSIS_ID,       Channels.base(() -> "")),
        Map.entry(STARTED_AT,        Channels.base(() -> 0L)),
        Map.entry(STAGE,             Channels.base(() -> AnalysisStage.CLASSIFYING.name())),
        Map.entry(CLASSIFIED,        Channels.base((Reducer<ClassifiedCapabilities>) null)),
        Map.entry(CONTEXT,           Channels.base((Supplier<List<ContextSnapshot>>) List::of)),
        Map.entry(SELECTED,          Channels.base((Supplier<List<CapabilityDescriptor>>) List::of)),
        Map.entry(EXECUTION,         Channels.base((Reducer<DataExecutionBatch>) null)),
        Map.entry(SECTIONS,          Channels.base((Reducer<AnalysisSections>) null)),
        Map.entry(CAPABILITIES_USED, Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(RECOMMENDATIONS,   Channels.base((Supplier<List<Recommendation>>) List::of)),
        Map.entry(ANALYSIS,          Channels.base((Reducer<Analysis>) null))
    );

    public AnalysisState(Map<String, Object> initData) {
        super(initData);
    }

    public String agentId() {
        return this.<String>value(AGENT_ID).orElse("");
    }

    public String analysisId() {
        return this.<String>value(ANALYSIS_ID).orElse("");
    }

    public long startedAt() {
        return this.<Long>value(STARTED_AT).orElse(0L);
    }

    public AnalysisStage stage() {
        return AnalysisStage.valueOf(this.<String>value(STAGE).orElse(AnalysisStage.CLASSIFYING.name()));
    }

    public ClassifiedCapabilities classified() {
        return this.<ClassifiedCapabilities>value(CLASSIFIED).orElse(ClassifiedCapabilities.empty());
    }

    public List<ContextSnapshot> context() {
        return this.<List<ContextSnapshot>>value(CONTEXT).orElse(List.of());
    }

    public List<CapabilityDescriptor> selectedCapabilities() {
        return this.<List<CapabilityDescriptor>>value(SELECTED).orElse(List.of());
    }

    public DataExecutionBatch execution() {
        return this.<DataExecutionBatch>value(EXECUTION).orElse(DataExecutionBatch.empty());
    }

    public Optional<AnalysisSections> sections() {
        return this.value(SECTIONS);
    }

    public List<String> capabilitiesUsed() {
        return this.<List<String>>value(CAPABILITIES_USED).orElse(List.of());
    }

    public List<Recommendation> recommendations() {
        return this.<List<Recommendation>>value(RECOMMENDATIONS).orElse(List.of());
    }

    public Optional<Analysis> analysis() {
        return this.value(ANALYSIS);
    }
}
