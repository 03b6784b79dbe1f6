package com.sentinel.core.model;

/**
 * Completion state of a task as the orchestrator reports it.
 */
public enum TaskStatus {
    PENDING,
    DONE
}
