package com.foresight.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} for the pipeline's inference calls.
 * <p>
 * Structured calls use {@link BeanOutputConverter} to append a JSON schema for the
 * target type to the user prompt and deserialize the reply; text calls return the
 * raw reply. Every call takes a sampling temperature. No retries are attempted here:
 * failures surface as exceptions and the calling stage decides how to isolate them.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule());
        log.info("LlmService initialized: provider: {}, model: {}",
                blankToDash(properties.getProvider()), blankToDash(properties.getModel()));
    }

    /**
     * Sends a system + user prompt and deserializes the reply into {@code outputType}.
     *
     * @param systemPrompt instructions for the model's role
     * @param userPrompt   the request text
     * @param outputType   record or POJO to deserialize into
     * @param temperature  sampling temperature
     * @param <T>          target type
     * @return an instance of {@code T} populated from the model's JSON reply
     * @throws LlmEmptyResponseException when the model returns nothing
     * @throws LlmParseException         when the reply is not valid JSON for {@code outputType}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType, double temperature) {
        log.info("LLM call started → {} (t={})", outputType.getSimpleName(), temperature);
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String fullUser = userPrompt + "\n\n" + converter.getFormat();
        logPrompt(systemPrompt, fullUser);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(fullUser)
                .options(ChatOptions.builder().temperature(temperature).build())
                .call()
                .content();
        logElapsed(outputType.getSimpleName(), start);
        requireContent(response, outputType.getSimpleName());
        return convert(converter, response, outputType);
    }

    /**
     * Sends a system + user prompt and returns the model's plain-text reply, trimmed.
     */
    public String textCall(String systemPrompt, String userPrompt, double temperature) {
        log.info("LLM text call started (t={})", temperature);
        long start = System.currentTimeMillis();
        logPrompt(systemPrompt, userPrompt);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .options(ChatOptions.builder().temperature(temperature).build())
                .call()
                .content();
        logElapsed("text", start);
        requireContent(response, "text");
        return response.trim();
    }

    /**
     * Like {@link #structuredCall}, but lets the model call the supplied tools
     * before answering. Falls back to the tool-less path when no tools are given.
     */
    public <T> T structuredCallWithTools(String systemPrompt, String userPrompt, Class<T> outputType,
                                         double temperature, ToolCallback... tools) {
        if (tools == null || tools.length == 0) {
            return structuredCall(systemPrompt, userPrompt, outputType, temperature);
        }
        log.info("LLM call with {} tool(s) started → {}", tools.length, outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String fullUser = userPrompt + "\n\n" + converter.getFormat();
        logPrompt(systemPrompt, fullUser);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(fullUser)
                .options(ChatOptions.builder().temperature(temperature).build())
                .toolCallbacks(tools)
                .call()
                .content();
        logElapsed(outputType.getSimpleName() + " with tools", start);
        requireContent(response, outputType.getSimpleName());
        return convert(converter, response, outputType);
    }

    private <T> T convert(BeanOutputConverter<T> converter, String response, Class<T> outputType) {
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("Converter failed for {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Lenient fallback: strips markdown fences and parses with a forgiving mapper.
     */
    private <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = json.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        try {
            T result = lenientMapper.readValue(cleaned, outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    private static void requireContent(String response, String label) {
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + label
                    + ". Check that the model is reachable and supports structured JSON output.");
        }
    }

    private void logPrompt(String systemPrompt, String userPrompt) {
        if (properties.isLogPrompts()) {
            log.debug("System prompt:\n{}\nUser prompt:\n{}", systemPrompt, userPrompt);
        }
    }

    private static void logElapsed(String label, long start) {
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete → {} ({}s)", label, String.format("%.1f", elapsed / 1000.0));
    }

    private static String blankToDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }
}
