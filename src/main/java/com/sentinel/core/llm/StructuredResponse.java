package com.sentinel.core.llm;

/**
 * A typed model response together with the token usage the endpoint reported.
 */
public record StructuredResponse<T>(
    T value,
    int promptTokens,
    int completionTokens
) {}
