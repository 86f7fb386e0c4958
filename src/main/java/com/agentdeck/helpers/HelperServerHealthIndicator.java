package com.agentdeck.helpers;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for helper servers.
 * Reports each server's state with its start and stop counters.
 */
@Component
@ConditionalOnProperty(prefix = "agentdeck.helpers", name = "enabled", havingValue = "true")
public class HelperServerHealthIndicator implements HealthIndicator {

    private final HelperServerManager manager;

    public HelperServerHealthIndicator(HelperServerManager manager) {
        this.manager = manager;
    }

    @Override
    public Health health() {
        if (manager.getServers().isEmpty()) {
            return Health.unknown().withDetail("reason", "not configured").build();
        }
        var builder = Health.up();
        boolean anyDown = false;
        for (HelperServer server : manager.getServers()) {
            String state = server.isRunning() ? "UP" : "DOWN";
            builder.withDetail(server.name(), state + " (starts=" + server.startCount()
                    + ", stops=" + server.stopCount() + ")");
            anyDown |= !server.isRunning();
        }
        return anyDown ? builder.status("DEGRADED").build() : builder.build();
    }
}
