package com.sentinel.core.tier;

import com.sentinel.core.model.Task;
import com.sentinel.core.model.TestResult;

/**
 * Runs the validation (test execution) for the work a task just completed.
 * Implementations throw {@link com.sentinel.core.runner.SentinelException}
 * when the check cannot be executed at all.
 */
@FunctionalInterface
public interface ValidationCheck {

    TestResult run(Task task);
}
