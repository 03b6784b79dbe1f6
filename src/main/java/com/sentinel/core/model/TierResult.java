package com.sentinel.core.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.io.Serializable;

/**
 * Outcome of one tier's bounded fix-attempt cycle. Immutable once created.
 *
 * @param tier       1 = local model, 2 = cloud model
 * @param attempted  true when at least the loop was entered
 * @param skipped    true when the tier never ran (endpoint unavailable)
 * @param passed     validation succeeded within this tier
 * @param iterations validation runs performed
 * @param costUsd    monetary cost reported by the tier's model calls
 * @param durationS  wall-clock seconds spent in the tier
 * @param exitReason terminal condition that ended the loop
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TierResult(
    int tier,
    boolean attempted,
    boolean skipped,
    boolean passed,
    int iterations,
    double costUsd,
    double durationS,
    TierExitReason exitReason
) implements Serializable {

    public static TierResult skipped(int tier) {
        return new TierResult(tier, false, true, false, 0, 0.0, 0.0, TierExitReason.UNAVAILABLE);
    }
}
