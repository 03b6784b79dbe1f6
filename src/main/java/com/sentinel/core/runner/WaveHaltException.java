package com.sentinel.core.runner;

import com.sentinel.core.model.ChangeRadiusViolation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Signals that the current wave must not be checkpointed. Raised only after the
 * run's audit artifacts have been written.
 */
public class WaveHaltException extends Exception {

    private final String reason;
    private final List<ChangeRadiusViolation> violations;
    private final String sentinelTaskId;

    public WaveHaltException(String reason, List<ChangeRadiusViolation> violations, String sentinelTaskId) {
        super(sentinelTaskId + " halted the wave (" + reason + "): " + describe(violations));
        this.reason = reason;
        this.violations = List.copyOf(violations);
        this.sentinelTaskId = sentinelTaskId;
    }

    public String reason() {
        return reason;
    }

    public List<ChangeRadiusViolation> violations() {
        return violations;
    }

    public String sentinelTaskId() {
        return sentinelTaskId;
    }

    private static String describe(List<ChangeRadiusViolation> violations) {
        return violations.stream().map(ChangeRadiusViolation::describe).collect(Collectors.joining("; "));
    }
}
