package com.sentinel.core.model;

import java.io.Serializable;

/**
 * Outcome of one validation (test) run against the working tree.
 */
public record TestResult(
    String taskId,
    boolean passed,
    int totalTests,
    int failedTests,
    String output,
    long durationMs
) implements Serializable {}
