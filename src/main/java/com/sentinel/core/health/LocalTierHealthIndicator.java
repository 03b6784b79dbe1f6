package com.sentinel.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes local tier reachability through the Actuator health endpoint.
 */
@Component
public class LocalTierHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public LocalTierHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        HealthStatus status = healthCheckService.checkLocalTier();
        Health.Builder builder = status.isUp()
                ? Health.up()
                : Health.status("DEGRADED");
        return builder.withDetail("detail", status.detail())
                .withDetails(status.metadata())
                .build();
    }
}
