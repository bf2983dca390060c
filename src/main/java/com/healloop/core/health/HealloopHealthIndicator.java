package com.healloop.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of {@link HealthCheckService}: DOWN when any component is down,
 * DEGRADED when any is degraded.
 */
@Component("healloopHealthIndicator")
public class HealloopHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public HealloopHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var builder = Health.up();
        boolean anyDown = false;
        boolean anyDegraded = false;
        for (HealthStatus check : healthCheckService.checkAll()) {
            builder.withDetail(check.component(), check.status().name() + ": " + check.detail());
            anyDown |= check.status() == HealthStatus.Status.DOWN;
            anyDegraded |= check.status() == HealthStatus.Status.DEGRADED;
        }
        if (anyDown) {
            return builder.down().build();
        }
        return anyDegraded ? builder.status("DEGRADED").build() : builder.build();
    }
}
