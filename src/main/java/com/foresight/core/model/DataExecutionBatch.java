package com.foresight.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Results of a DATA execution stage and the ephemeral rooms it opened.
 */
public record DataExecutionBatch(List<ExecutionResult> results, List<String> roomIds) implements Serializable {

    public DataExecutionBatch {
        results = results == null ? List.of() : List.copyOf(results);
        roomIds = roomIds == null ? List.of() : List.copyOf(roomIds);
    }

    public static DataExecutionBatch empty() {
        return new DataExecutionBatch(List.of(), List.of());
    }
}
