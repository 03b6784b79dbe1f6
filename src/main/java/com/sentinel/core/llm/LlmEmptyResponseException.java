package com.sentinel.core.llm;

/**
 * Thrown when a tier's model returns no content for a structured call, usually
 * because the endpoint is up but no model is loaded.
 */
public class LlmEmptyResponseException extends RuntimeException {

    private final String tier;

    public LlmEmptyResponseException(String tier, String outputType) {
        super("[" + tier + "] LLM returned empty content for " + outputType
                + ". Check that the model is loaded and supports JSON output.");
        this.tier = tier;
    }

    public String tier() {
        return tier;
    }
}
