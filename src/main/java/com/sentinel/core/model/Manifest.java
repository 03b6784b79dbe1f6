package com.sentinel.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Permanent audit record of one Sentinel run, serialized as {@code manifest.json}.
 *
 * @param taskId          the Sentinel task identifier
 * @param parentTaskId    the task that was validated
 * @param result          PASS, FAIL or ERROR
 * @param tierUsed        highest tier that ran iterations (0 when none ran)
 * @param iterations      validation runs across all tiers
 * @param costUsd         total reported model cost
 * @param filesChanged    modified paths in diff order
 * @param tiers           per-tier results in execution order
 * @param violations      change-radius violations
 * @param cascadeMode     cascade mode in effect
 * @param cascadeDecision label of the cascade outcome, {@code null} when no cascade ran
 * @param error           fault message when {@code result == ERROR}
 * @param startedAt       run start
 * @param finishedAt      run end (before the write)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Manifest(
    String taskId,
    String parentTaskId,
    RunResult result,
    int tierUsed,
    int iterations,
    double costUsd,
    List<String> filesChanged,
    List<TierResult> tiers,
    List<ChangeRadiusViolation> violations,
    CascadeMode cascadeMode,
    String cascadeDecision,
    String error,
    Instant startedAt,
    Instant finishedAt
) implements Serializable {

    public Manifest {
        filesChanged = filesChanged != null ? List.copyOf(filesChanged) : List.of();
        tiers = tiers != null ? List.copyOf(tiers) : List.of();
        violations = violations != null ? List.copyOf(violations) : List.of();
    }
}
