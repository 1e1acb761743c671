package com.keystone.broker;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for configured tool servers.
 * Pings every enabled server; one unreachable server degrades but does not fail the broker.
 */
@Component
public class ToolBrokerHealthIndicator implements HealthIndicator {

    private final ToolBroker broker;

    public ToolBrokerHealthIndicator(ToolBroker broker) {
        this.broker = broker;
    }

    @Override
    public Health health() {
        var servers = broker.servers();
        if (servers.isEmpty()) {
            return Health.unknown().withDetail("reason", "no tool servers configured").build();
        }

        var builder = Health.up();
        int enabled = 0;
        int down = 0;
        for (ToolServerConfig server : servers) {
            if (!server.enabled()) {
                builder.withDetail(server.serverId(), "disabled");
                continue;
            }
            enabled++;
            if (broker.ping(server.serverId())) {
                builder.withDetail(server.serverId(), "UP (" + server.transport() + ")");
            } else {
                builder.withDetail(server.serverId(), "DOWN (" + server.transport() + ")");
                down++;
            }
        }

        if (enabled > 0 && down == enabled) {
            return builder.down().build();
        }
        return down > 0 ? builder.status("DEGRADED").build() : builder.build();
    }
}
