package com.sentinel.core.tier;

import com.sentinel.core.config.SentinelProperties;

import java.time.Duration;

/**
 * Limits and repair capability of one escalation tier.
 *
 * @param tier          1 = local, 2 = cloud
 * @param maxIterations validation runs allowed
 * @param timeout       wall-clock limit for the whole loop
 * @param budgetUsd     monetary limit; {@code 0} means the tier is not metered
 * @param agent         the tier's repair action
 */
public record TierSpec(
    int tier,
    int maxIterations,
    Duration timeout,
    double budgetUsd,
    RepairAgent agent
) {

    public static final int LOCAL = 1;
    public static final int CLOUD = 2;

    public static TierSpec local(SentinelProperties.Tier config, RepairAgent agent) {
        return new TierSpec(LOCAL, config.getMaxIterations(), Duration.ofSeconds(config.getTimeoutSeconds()), 0.0, agent);
    }

    public static TierSpec cloud(SentinelProperties.Tier config, RepairAgent agent) {
        return new TierSpec(CLOUD, config.getMaxIterations(), Duration.ofSeconds(config.getTimeoutSeconds()),
                config.getBudgetUsd(), agent);
    }

    public boolean metered() {
        return budgetUsd > 0;
    }
}
