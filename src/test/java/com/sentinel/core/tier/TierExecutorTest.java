package com.sentinel.core.tier;

import com.sentinel.core.model.Task;
import com.sentinel.core.model.TestResult;
import com.sentinel.core.model.TierExitReason;
import com.sentinel.core.model.TierResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TierExecutorTest {

    private static final Task TASK = Task.sentinelFor(new Task("TASK-001", "CODER", "x", Set.of(), null, List.of()));

    private static TestResult failing() {
        return new TestResult(TASK.id(), false, 4, 1, "Tests run: 4, Failures: 1", 10);
    }

    private static TestResult passing() {
        return new TestResult(TASK.id(), true, 4, 0, "Tests run: 4, Failures: 0", 10);
    }

    /** Advances a fixed step on every read. */
    private static final class SteppingClock extends Clock {
        private Instant now = Instant.parse("2026-01-01T00:00:00Z");
        private final Duration step;

        SteppingClock(Duration step) {
            this.step = step;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            Instant current = now;
            now = now.plus(step);
            return current;
        }
    }

    @Test
    @DisplayName("Tier 1 that never passes stops at its 5-iteration cap")
    void iterationCap() throws RepairException {
        RepairAgent agent = mock(RepairAgent.class);
        when(agent.repair(any())).thenReturn(new RepairOutcome("tried", List.of("src/A.java"), 0.0));
        var executor = new TierExecutor(task -> failing(), Clock.systemUTC());

        TierResult result = executor.execute(new TierSpec(TierSpec.LOCAL, 5, Duration.ofMinutes(5), 0.0, agent), TASK);

        assertEquals(1, result.tier());
        assertFalse(result.passed());
        assertEquals(5, result.iterations());
        assertTrue(result.attempted());
        assertFalse(result.skipped());
        assertEquals(TierExitReason.ITERATION_CAP, result.exitReason());
        verify(agent, times(4)).repair(any());
    }

    @Test
    @DisplayName("Passing validation stops the loop immediately")
    void passesOnThirdIteration() throws RepairException {
        var runs = new AtomicInteger();
        RepairAgent agent = mock(RepairAgent.class);
        when(agent.repair(any())).thenReturn(new RepairOutcome("fix", List.of(), 0.0));
        var executor = new TierExecutor(task -> runs.incrementAndGet() == 3 ? passing() : failing(), Clock.systemUTC());

        TierResult result = executor.execute(new TierSpec(TierSpec.LOCAL, 5, Duration.ofMinutes(5), 0.0, agent), TASK);

        assertTrue(result.passed());
        assertEquals(3, result.iterations());
        assertEquals(TierExitReason.PASSED, result.exitReason());
        verify(agent, times(2)).repair(any());
    }

    @Test
    @DisplayName("Metered tier stops once the budget is spent")
    void budget() throws RepairException {
        RepairAgent agent = mock(RepairAgent.class);
        when(agent.repair(any())).thenReturn(new RepairOutcome("fix", List.of("a"), 1.5));
        var executor = new TierExecutor(task -> failing(), Clock.systemUTC());

        TierResult result = executor.execute(new TierSpec(TierSpec.CLOUD, 10, Duration.ofMinutes(10), 2.0, agent), TASK);

        assertEquals(TierExitReason.BUDGET_EXHAUSTED, result.exitReason());
        assertEquals(2, result.iterations());
        assertEquals(3.0, result.costUsd(), 1e-9);
    }

    @Test
    @DisplayName("Wall-clock deadline ends the loop before the next iteration")
    void timeout() throws RepairException {
        RepairAgent agent = mock(RepairAgent.class);
        when(agent.repair(any())).thenReturn(new RepairOutcome("fix", List.of(), 0.0));
        var executor = new TierExecutor(task -> failing(), new SteppingClock(Duration.ofSeconds(40)));

        TierResult result = executor.execute(new TierSpec(TierSpec.LOCAL, 50, Duration.ofSeconds(100), 0.0, agent), TASK);

        assertEquals(TierExitReason.TIMEOUT, result.exitReason());
        assertFalse(result.passed());
        assertTrue(result.iterations() >= 1 && result.iterations() < 50);
    }

    @Test
    @DisplayName("A failed repair spends the iteration and keeps its cost")
    void repairFailure() throws RepairException {
        RepairAgent agent = mock(RepairAgent.class);
        when(agent.repair(any())).thenThrow(new RepairException("model said nothing", 0.25));
        var executor = new TierExecutor(task -> failing(), Clock.systemUTC());

        TierResult result = executor.execute(new TierSpec(TierSpec.CLOUD, 3, Duration.ofMinutes(10), 2.0, agent), TASK);

        assertEquals(3, result.iterations());
        assertEquals(0.5, result.costUsd(), 1e-9);
        assertEquals(TierExitReason.ITERATION_CAP, result.exitReason());
    }
}
