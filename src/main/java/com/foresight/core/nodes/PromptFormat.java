package com.foresight.core.nodes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.foresight.core.model.CapabilityDescriptor;
import com.foresight.core.model.ContextSnapshot;
import com.foresight.core.model.ExampleExchange;
import com.foresight.core.model.ExampleMessage;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders capabilities, snapshots and payloads into prompt text.
 */
final class PromptFormat {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private PromptFormat() {}

    static String capability(CapabilityDescriptor capability, int maxExamples) {
        var sb = new StringBuilder();
        sb.append("Name: ").append(capability.name()).append('\n');
        sb.append("Description: ").append(nullToEmpty(capability.description())).append('\n');
        if (!capability.similes().isEmpty()) {
            sb.append("Also known as: ").append(String.join(", ", capability.similes())).append('\n');
        }
        List<ExampleExchange> examples = capability.examples();
        if (!examples.isEmpty() && maxExamples > 0) {
            sb.append("Examples:\n");
            examples.stream().limit(maxExamples).forEach(example -> sb.append(exchange(example)).append('\n'));
        }
        return sb.toString();
    }

    static String capabilityList(List<CapabilityDescriptor> capabilities) {
        return capabilities.stream()
                .map(c -> "- " + c.name() + ": " + nullToEmpty(c.description()))
                .collect(Collectors.joining("\n"));
    }

    static String context(List<ContextSnapshot> snapshots) {
        if (snapshots.isEmpty()) {
            return "(no context available)";
        }
        return snapshots.stream()
                .map(s -> "[" + s.providerName() + "]\n" + json(s.data()))
                .collect(Collectors.joining("\n\n"));
    }

    static String json(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return s;
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String exchange(ExampleExchange exchange) {
        return exchange.messages().stream()
                .map(PromptFormat::message)
                .collect(Collectors.joining("\n"));
    }

    private static String message(ExampleMessage message) {
        return "  " + nullToEmpty(message.speaker()) + ": " + nullToEmpty(message.text());
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
