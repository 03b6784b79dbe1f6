package com.sentinel.core.llm;

/**
 * Thrown when a tier's model response cannot be mapped onto the requested type,
 * even after the lenient Jackson fallback.
 */
public class LlmParseException extends RuntimeException {

    private final String tier;
    private final String outputType;

    public LlmParseException(String tier, String outputType, Throwable cause) {
        super("[" + tier + "] Failed to parse LLM response to " + outputType + ": " + cause.getMessage(), cause);
        this.tier = tier;
        this.outputType = outputType;
    }

    public String tier() {
        return tier;
    }

    public String outputType() {
        return outputType;
    }
}
