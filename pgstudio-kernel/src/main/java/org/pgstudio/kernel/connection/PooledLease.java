package org.pgstudio.kernel.connection;

import java.sql.Connection;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A connection borrowed from a pool. Use with try-with-resources: the lease goes back to its pool
 * exactly once no matter how the block exits.
 */
public final class PooledLease implements AutoCloseable {

    private final ConnectionMultiplexer owner;
    private final ConnectionKey key;
    private final Connection connection;
    private final AtomicBoolean released = new AtomicBoolean(false);

    PooledLease(ConnectionMultiplexer owner, ConnectionKey key, Connection connection) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.key = Objects.requireNonNull(key, "key");
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    public ConnectionKey key() {
        return key;
    }

    public Connection connection() {
        if (released.get()) {
            throw new IllegalStateException("Lease for " + key + " was already released");
        }
        return connection;
    }

    public boolean isReleased() {
        return released.get();
    }

    /** @return true if this call released the lease, false if it was already released */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    Connection rawConnection() {
        return connection;
    }

    @Override
    public void close() {
        owner.release(this);
    }
}
