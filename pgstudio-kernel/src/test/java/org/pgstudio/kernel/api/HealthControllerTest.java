package org.pgstudio.kernel.api;

import org.junit.jupiter.api.Test;
import org.pgstudio.kernel.connection.ConnectionMultiplexer;
import org.pgstudio.kernel.connection.ConnectionPool;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthEndpoint;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    @Test
    void reportsStatusAndConnectionCounts() {
        HealthEndpoint endpoint = mock(HealthEndpoint.class);
        ConnectionMultiplexer connections = mock(ConnectionMultiplexer.class);
        ConnectionPool sales = mock(ConnectionPool.class);
        ConnectionPool hr = mock(ConnectionPool.class);
        when(endpoint.health()).thenReturn(Health.up().build());
        when(sales.activeConnections()).thenReturn(2);
        when(hr.activeConnections()).thenReturn(1);
        when(connections.pools()).thenReturn(List.of(sales, hr));
        when(connections.poolCount()).thenReturn(2);
        when(connections.sessionCount()).thenReturn(3);

        Map<String, Object> body = new HealthController(endpoint, connections).health();

        assertThat(body).containsExactly(
                Map.entry("status", "UP"),
                Map.entry("pools", 2),
                Map.entry("sessions", 3),
                Map.entry("activeConnections", 3));
    }
}
