package com.sentinel.core.tier;

import com.sentinel.core.model.Task;
import com.sentinel.core.model.TestResult;

/**
 * Input for one bounded repair action.
 *
 * @param task       the task whose work is being repaired
 * @param tier       1 = local, 2 = cloud
 * @param iteration  1-based iteration that produced {@code lastResult}
 * @param lastResult the failing validation result
 */
public record RepairRequest(
    Task task,
    int tier,
    int iteration,
    TestResult lastResult
) {}
