package com.armada.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Actuator view of {@link HealthCheckService}: DOWN when any component is down,
 * DEGRADED when any is degraded, UP otherwise. Each component is one detail entry.
 */
@Component("armadaHealthIndicator")
public class ArmadaHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public ArmadaHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        List<HealthStatus> checks = healthCheckService.checkAll();
        var builder = switch (HealthStatus.worst(checks)) {
            case UP -> Health.up();
            case DEGRADED -> Health.status("DEGRADED");
            case DOWN -> Health.down();
        };
        for (HealthStatus check : checks) {
            builder.withDetail(check.component(), check.status() + ": " + check.detail());
        }
        return builder.build();
    }
}
