package com.sentinel.core.model;

/**
 * Which terminal condition ended a tier's fix-attempt loop.
 */
public enum TierExitReason {
    PASSED,
    ITERATION_CAP,
    TIMEOUT,
    BUDGET_EXHAUSTED,
    UNAVAILABLE
}
