package com.sentinel.core.model;

/**
 * The three discrete responses accepted from a human gate.
 */
public enum CascadeChoice {
    AUTO_APPLY,
    REVIEW_AND_HALT,
    HALT;

    public boolean halts() {
        return this != AUTO_APPLY;
    }
}
