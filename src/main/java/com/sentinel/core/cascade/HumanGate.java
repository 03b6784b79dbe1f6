package com.sentinel.core.cascade;

import com.sentinel.core.model.CascadeChoice;
import com.sentinel.core.model.ChangeRadiusViolation;

import java.util.List;

/**
 * Channel through which a human picks how a radius violation propagates.
 */
@FunctionalInterface
public interface HumanGate {

    /**
     * Blocks until one of the three choices is made. Implementations return
     * {@link CascadeChoice#HALT} when the channel closes without an answer.
     */
    CascadeChoice ask(String sentinelTaskId, List<ChangeRadiusViolation> violations);
}
