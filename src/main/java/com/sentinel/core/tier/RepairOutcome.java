package com.sentinel.core.tier;

import java.util.List;

/**
 * Result of one repair action.
 *
 * @param summary      what the repair changed, in the model's words
 * @param filesWritten relative paths rewritten in the working tree
 * @param costUsd      monetary cost of the call(s) made
 */
public record RepairOutcome(
    String summary,
    List<String> filesWritten,
    double costUsd
) {

    public RepairOutcome {
        filesWritten = filesWritten != null ? List.copyOf(filesWritten) : List.of();
    }
}
