package com.sentinel.core.metrics;

import com.sentinel.core.model.RadiusAxis;
import com.sentinel.core.model.RunResult;
import com.sentinel.core.model.TierResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Sentinel runs.
 */
@Service
public class SentinelMetrics {

    private final MeterRegistry registry;

    public SentinelMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(RunResult result) {
        Counter.builder("sentinel.runs.total")
                .tag("result", result.name())
                .register(registry)
                .increment();
    }

    public void recordRunDuration(long ms) {
        Timer.builder("sentinel.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one tier's duration, iteration depth and terminal condition.
     */
    public void recordTier(TierResult result) {
        String tier = String.valueOf(result.tier());
        Counter.builder("sentinel.tier.outcomes")
                .description("Tier loops by terminal condition")
                .tag("tier", tier)
                .tag("exit", result.exitReason().name())
                .register(registry)
                .increment();
        if (!result.attempted()) {
            return;
        }
        Timer.builder("sentinel.tier.duration")
                .tag("tier", tier)
                .register(registry)
                .record(Duration.ofMillis(Math.round(result.durationS() * 1000)));
        DistributionSummary.builder("sentinel.tier.iterations")
                .tag("tier", tier)
                .register(registry)
                .record(result.iterations());
    }

    public void recordCost(double usd) {
        DistributionSummary.builder("sentinel.cost.usd")
                .description("Model cost per Sentinel run")
                .register(registry)
                .record(usd);
    }

    public void recordViolation(RadiusAxis axis) {
        Counter.builder("sentinel.radius.violations")
                .tag("axis", axis.label())
                .register(registry)
                .increment();
    }

    public void recordWaveHalt() {
        Counter.builder("sentinel.waves.halted")
                .description("Waves halted by a change-radius decision")
                .register(registry)
                .increment();
    }

    public void recordProbe(boolean available) {
        Counter.builder("sentinel.probe.checks")
                .tag("available", String.valueOf(available))
                .register(registry)
                .increment();
    }
}
