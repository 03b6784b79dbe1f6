package com.sentinel.core.model;

/**
 * How changed lines are totalled for the {@code lines} axis.
 */
public enum LineCountMode {
    /** additions + deletions */
    GROSS,
    /** |additions - deletions| per file */
    NET
}
