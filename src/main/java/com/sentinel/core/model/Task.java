package com.sentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * A single unit of work within an execution plan.
 *
 * @param id           unique identifier (e.g., "TASK-001")
 * @param agentRole    type of worker: CODER, TESTER, REFACTORER, ... or {@value #SENTINEL_ROLE}
 * @param description  what this task should accomplish
 * @param dependencies IDs of tasks that must complete first
 * @param status       completion state reported by the orchestrator
 * @param targetFiles  files this task intends to create/modify (set by the planner)
 */
public record Task(
    String id,
    String agentRole,
    String description,
    Set<String> dependencies,
    TaskStatus status,
    List<String> targetFiles
) implements Serializable {

    public static final String SENTINEL_ROLE = "Sentinel";
    public static final String SENTINEL_PREFIX = "SENTINEL-";

    public Task {
        dependencies = dependencies != null ? Set.copyOf(dependencies) : Set.of();
        targetFiles = targetFiles != null ? List.copyOf(targetFiles) : List.of();
        status = status != null ? status : TaskStatus.PENDING;
    }

    /**
     * Builds the Sentinel task that validates {@code parent}.
     */
    public static Task sentinelFor(Task parent) {
        return new Task(
                SENTINEL_PREFIX + parent.id(),
                SENTINEL_ROLE,
                "Validate " + parent.id() + " (" + parent.agentRole() + ")",
                Set.of(parent.id()),
                TaskStatus.PENDING,
                List.of());
    }

    @JsonIgnore
    public boolean isSentinel() {
        return SENTINEL_ROLE.equals(agentRole);
    }

    /**
     * For a Sentinel task, the id of the task it validates; {@code null} otherwise.
     */
    public String parentId() {
        if (!isSentinel() || dependencies.size() != 1) {
            return null;
        }
        return dependencies.iterator().next();
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, agentRole, description, dependencies, newStatus, targetFiles);
    }
}
