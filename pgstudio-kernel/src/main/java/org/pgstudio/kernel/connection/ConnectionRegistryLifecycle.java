package org.pgstudio.kernel.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Objects;

/** Drains every pool, session and tunnel when the application context shuts down. */
@Component
public class ConnectionRegistryLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistryLifecycle.class);

    private final ConnectionMultiplexer multiplexer;
    private volatile boolean running;

    public ConnectionRegistryLifecycle(ConnectionMultiplexer multiplexer) {
        this.multiplexer = Objects.requireNonNull(multiplexer, "multiplexer");
    }

    @Override
    public void start() {
        this.running = true;
    }

    @Override
    public void stop() {
        this.running = false;
        log.info("Closing {} pools and {} sessions", multiplexer.poolCount(), multiplexer.sessionCount());
        multiplexer.closeAll();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
