package com.sentinel.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;

/**
 * Wraps Spring AI's {@link ChatClient} for one model tier to produce
 * structured (typed) output from LLM calls.
 * <p>
 * Uses {@link BeanOutputConverter} to generate a JSON schema from the target
 * Java class, append format instructions to the user prompt, and deserialize
 * the LLM's JSON response into the requested type. Token usage is returned
 * alongside the value so callers can price the call.
 */
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final String tierName;

    public LlmService(ChatClient chatClient, String tierName) {
        this.chatClient = chatClient;
        this.tierName = tierName;
    }

    public String tierName() {
        return tierName;
    }

    /**
     * Sends a system + user prompt and deserializes the response into {@code outputType}.
     *
     * @param systemPrompt instructions for the model's role / behaviour
     * @param userPrompt   the request text
     * @param outputType   the Java class (record or POJO) to deserialize into
     * @param <T>          target type
     * @return the typed value with reported token usage
     */
    public <T> StructuredResponse<T> structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.info("[{}] LLM call started -> {}", tierName, outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        ChatResponse chatResponse = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .chatResponse();
        long elapsed = System.currentTimeMillis() - start;

        String content = null;
        if (chatResponse != null && chatResponse.getResult() != null && chatResponse.getResult().getOutput() != null) {
            content = chatResponse.getResult().getOutput().getText();
        }
        int promptTokens = 0;
        int completionTokens = 0;
        if (chatResponse != null && chatResponse.getMetadata() != null) {
            Usage usage = chatResponse.getMetadata().getUsage();
            if (usage != null) {
                promptTokens = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
                completionTokens = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
            }
        }
        log.info("[{}] LLM call complete -> {} ({}s, {} prompt / {} completion tokens)", tierName,
                outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0), promptTokens, completionTokens);

        if (content == null || content.isBlank()) {
            throw new LlmEmptyResponseException(tierName, outputType.getSimpleName());
        }
        T value;
        try {
            value = converter.convert(content);
        } catch (Exception e) {
            log.error("[{}] Failed to parse LLM response to {}: {}", tierName, outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", content);
            value = parseWithJackson(content, outputType);
        }
        return new StructuredResponse<>(value, promptTokens, completionTokens);
    }

    /**
     * Fallback JSON parsing using a lenient Jackson ObjectMapper; strips markdown fences.
     */
    <T> T parseWithJackson(String json, Class<T> outputType) {
        log.info("[{}] Attempting Jackson fallback parsing for {}", tierName, outputType.getSimpleName());
        try {
            var mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
            mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

            String cleaned = json.trim();
            if (cleaned.startsWith("```json")) {
                cleaned = cleaned.substring(7);
            } else if (cleaned.startsWith("```")) {
                cleaned = cleaned.substring(3);
            }
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
            return mapper.readValue(cleaned.trim(), outputType);
        } catch (Exception e2) {
            log.error("[{}] Jackson fallback parsing FAILED for {}: {}", tierName, outputType.getSimpleName(), e2.getMessage());
            throw new LlmParseException(tierName, outputType.getSimpleName(), e2);
        }
    }
}
