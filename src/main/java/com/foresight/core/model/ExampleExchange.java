package com.foresight.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One illustrative conversation showing how a capability is triggered.
 */
public record ExampleExchange(List<ExampleMessage> messages) implements Serializable {

    public ExampleExchange {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
