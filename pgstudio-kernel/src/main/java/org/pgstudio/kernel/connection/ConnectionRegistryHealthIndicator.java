package org.pgstudio.kernel.connection;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Reports open pools and sessions. Always UP: an idle kernel with no connections is healthy. */
@Component("connections")
public class ConnectionRegistryHealthIndicator implements HealthIndicator {

    private final ConnectionMultiplexer multiplexer;

    public ConnectionRegistryHealthIndicator(ConnectionMultiplexer multiplexer) {
        this.multiplexer = Objects.requireNonNull(multiplexer, "multiplexer");
    }

    @Override
    public Health health() {
        Map<String, Object> perPool = new LinkedHashMap<>();
        for (ConnectionPool p : multiplexer.pools()) {
            perPool.put(p.key().toString(), Map.of(
                    "active", p.activeConnections(),
                    "idle", p.idleConnections()));
        }
        return Health.up()
                .withDetail("pools", multiplexer.poolCount())
                .withDetail("sessions", multiplexer.sessionCount())
                .withDetail("poolDetails", perPool)
                .build();
    }
}
