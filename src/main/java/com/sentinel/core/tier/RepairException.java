package com.sentinel.core.tier;

/**
 * A repair action failed without damaging the run: the model was unreachable,
 * answered with nothing usable, or proposed edits outside the project. The tier
 * loop counts the iteration as spent and keeps going.
 */
public class RepairException extends Exception {

    private final double costUsd;

    public RepairException(String message, double costUsd, Throwable cause) {
        super(message, cause);
        this.costUsd = costUsd;
    }

    public RepairException(String message, double costUsd) {
        this(message, costUsd, null);
    }

    /** Cost already incurred before the failure. */
    public double costUsd() {
        return costUsd;
    }
}
