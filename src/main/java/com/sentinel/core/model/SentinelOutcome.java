package com.sentinel.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * What a completed (non-halted) Sentinel run hands back to the orchestrator.
 */
public record SentinelOutcome(
    Manifest manifest,
    List<ChangeRadiusViolation> violations,
    CascadeDecision decision,
    Path artifactDir
) {}
