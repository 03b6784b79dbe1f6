package com.sentinel.core.model;

import java.io.Serializable;

/**
 * What the cascade step decided for a run.
 *
 * @param mode       cascade mode in effect
 * @param choice     human response, {@code null} in auto mode
 * @param annotated  number of task-list entries that received a warning block
 * @param halt       true when the wave must not be checkpointed
 */
public record CascadeDecision(
    CascadeMode mode,
    CascadeChoice choice,
    int annotated,
    boolean halt
) implements Serializable {

    public String label() {
        if (halt) {
            return "halt" + (choice != null ? " (" + choice.name().toLowerCase().replace('_', '-') + ")" : "");
        }
        return "warned " + annotated + " pending task" + (annotated != 1 ? "s" : "");
    }
}
