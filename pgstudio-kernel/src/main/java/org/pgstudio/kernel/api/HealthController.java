package org.pgstudio.kernel.api;

import org.pgstudio.kernel.connection.ConnectionMultiplexer;
import org.pgstudio.kernel.connection.ConnectionPool;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Status line for the editor front end: the aggregate Actuator status plus how many pools,
 * sessions and borrowed connections the kernel holds right now.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final ConnectionMultiplexer connections;

    public HealthController(HealthEndpoint healthEndpoint, ConnectionMultiplexer connections) {
        this.healthEndpoint = Objects.requireNonNull(healthEndpoint);
        this.connections = Objects.requireNonNull(connections);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        int active = 0;
        for (ConnectionPool p : connections.pools()) {
            active += p.activeConnections();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", healthEndpoint.health().getStatus().getCode());
        out.put("pools", connections.poolCount());
        out.put("sessions", connections.sessionCount());
        out.put("activeConnections", active);
        return out;
    }
}
