package org.pgstudio.kernel.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The dedicated connection of one (connection key, session id) pair.
 *
 * <p>Lives across script executions until it is closed through the
 * {@link ConnectionMultiplexer} or its connection dies. Callers that run statements hold
 * {@link #executionLock()} so two scripts never interleave on the same session.
 */
public final class SessionLease {
    private static final Logger log = LoggerFactory.getLogger(SessionLease.class);

    private final ConnectionKey key;
    private final String sessionId;
    private final Connection connection;
    private final Instant openedAt;
    private final ReentrantLock executionLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Integer backendPid;

    SessionLease(ConnectionKey key, String sessionId, Connection connection) {
        this.key = Objects.requireNonNull(key, "key");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.openedAt = Instant.now();
    }

    public ConnectionKey key() {
        return key;
    }

    public String sessionId() {
        return sessionId;
    }

    public Connection connection() {
        return connection;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public ReentrantLock executionLock() {
        return executionLock;
    }

    /** Backend pid cached after the first successful lookup; null if unknown. */
    public Integer backendPid() {
        return backendPid;
    }

    public void backendPid(Integer pid) {
        this.backendPid = pid;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean isAlive(Duration validationTimeout) {
        if (closed.get()) return false;
        try {
            if (connection.isClosed()) return false;
            int seconds = (int) Math.max(1, validationTimeout.toSeconds());
            return connection.isValid(seconds);
        } catch (SQLException e) {
            log.debug("Validation of session {} failed: {}", this, e.getMessage());
            return false;
        }
    }

    /** Idempotent: the underlying connection is closed at most once. */
    boolean close() {
        if (!closed.compareAndSet(false, true)) return false;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing session {}: {}", this, e.getMessage());
        }
        return true;
    }

    @Override
    public String toString() {
        return key + ":session:" + sessionId;
    }
}
