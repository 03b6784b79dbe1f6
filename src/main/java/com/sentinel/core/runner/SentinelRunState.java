package com.sentinel.core.runner;

/**
 * States of one Sentinel run. WRITING is entered on every path, including faults;
 * DONE and HALTED are terminal.
 */
public enum SentinelRunState {
    PROBING,
    TIER1_RUNNING,
    TIER2_RUNNING,
    DIFFING,
    EVALUATING,
    CASCADING,
    WRITING,
    DONE,
    HALTED
}
