package com.sentinel.core.tier;

import com.sentinel.core.logging.MdcContext;
import com.sentinel.core.model.Task;
import com.sentinel.core.model.TestResult;
import com.sentinel.core.model.TierExitReason;
import com.sentinel.core.model.TierResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs one bounded fix-attempt cycle for a tier.
 * <p>
 * Each iteration validates the working tree; on failure, and only if another
 * iteration is still permitted, one repair action runs before the next check.
 * Limits (iteration cap, wall-clock deadline, monetary budget) are checked before
 * an iteration starts; an iteration already in flight always runs to completion.
 */
@Component
public class TierExecutor {

    private static final Logger log = LoggerFactory.getLogger(TierExecutor.class);

    private final ValidationCheck validation;
    private final Clock clock;

    public TierExecutor(ValidationCheck validation, Clock clock) {
        this.validation = validation;
        this.clock = clock;
    }

    public TierResult execute(TierSpec spec, Task task) {
        MdcContext.setTier(spec.tier());
        try {
            return loop(spec, task);
        } finally {
            MdcContext.clearTier();
        }
    }

    private TierResult loop(TierSpec spec, Task task) {
        Instant start = clock.instant();
        Instant deadline = start.plus(spec.timeout());
        int iterations = 0;
        double cost = 0.0;
        TierExitReason exit;

        log.info("Tier {} starting for {} (max {} iterations, {}s{})", spec.tier(), task.id(),
                spec.maxIterations(), spec.timeout().toSeconds(),
                spec.metered() ? String.format(", budget $%.2f", spec.budgetUsd()) : "");

        while (true) {
            TierExitReason limit = limitReached(spec, iterations, cost, deadline);
            if (limit != null) {
                exit = limit;
                break;
            }
            iterations++;
            TestResult result = validation.run(task);
            if (result.passed()) {
                exit = TierExitReason.PASSED;
                break;
            }
            log.info("Tier {} iteration {}: validation failed ({} of {} tests)",
                    spec.tier(), iterations, result.failedTests(), result.totalTests());

            // a repair nobody re-checks is wasted work
            if (limitReached(spec, iterations, cost, deadline) != null) {
                continue;
            }
            try {
                RepairOutcome outcome = spec.agent().repair(new RepairRequest(task, spec.tier(), iterations, result));
                cost += outcome.costUsd();
                log.info("Tier {} iteration {}: repair touched {} ({})", spec.tier(), iterations,
                        outcome.filesWritten(), String.format("$%.4f", outcome.costUsd()));
            } catch (RepairException e) {
                cost += e.costUsd();
                log.warn("Tier {} iteration {}: repair failed: {}", spec.tier(), iterations, e.getMessage());
            }
        }

        double durationS = Duration.between(start, clock.instant()).toMillis() / 1000.0;
        boolean passed = exit == TierExitReason.PASSED;
        log.info("Tier {} finished for {}: {} after {} iteration(s), {}s, ${}", spec.tier(), task.id(),
                exit, iterations, String.format("%.1f", durationS), String.format("%.4f", cost));
        return new TierResult(spec.tier(), true, false, passed, iterations, cost, durationS, exit);
    }

    private TierExitReason limitReached(TierSpec spec, int iterations, double cost, Instant deadline) {
        if (iterations >= spec.maxIterations()) {
            return TierExitReason.ITERATION_CAP;
        }
        if (!clock.instant().isBefore(deadline)) {
            return TierExitReason.TIMEOUT;
        }
        if (spec.metered() && cost >= spec.budgetUsd()) {
            return TierExitReason.BUDGET_EXHAUSTED;
        }
        return null;
    }
}
