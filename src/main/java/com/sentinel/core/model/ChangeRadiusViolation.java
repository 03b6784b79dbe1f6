package com.sentinel.core.model;

import java.io.Serializable;

/**
 * A single budget exceeded by a Sentinel run.
 */
public record ChangeRadiusViolation(
    RadiusAxis axis,
    long observed,
    long budget
) implements Serializable {

    public String describe() {
        return axis.label() + ": observed " + observed + ", budget " + budget;
    }
}
