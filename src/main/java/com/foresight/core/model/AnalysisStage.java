package com.foresight.core.model;

/**
 * Progress marker for an analysis run, recorded in the graph state by each node.
 */
public enum AnalysisStage {
    CLASSIFYING,
    COLLECTING_CONTEXT,
    SELECTING,
    EXECUTING,
    RELEASING_ROOMS,
    SYNTHESIZING,
    RECOMMENDING,
    PERSISTING,
    COMPLETED
}
