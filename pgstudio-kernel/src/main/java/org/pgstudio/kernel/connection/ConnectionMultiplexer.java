package org.pgstudio.kernel.connection;

import org.pgstudio.kernel.config.KernelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out connections in two modes.
 *
 * <ul>
 *   <li><b>Pooled leases</b>: short-lived, borrowed from a per-{@link ConnectionKey} pool and
 *       released after one operation (metadata lookups, cancellation).</li>
 *   <li><b>Session leases</b>: one dedicated connection per (key, session id) that keeps its
 *       server-side state (temp tables, {@code SET}, open transactions) across scripts.</li>
 * </ul>
 *
 * <p>Pools, sessions and the resolved {@link JdbcTarget}s are created lazily on first use and live
 * until one of the {@code close*} methods removes them. Each resource is removed from its registry
 * before it is closed, so it is closed at most once.
 */
public class ConnectionMultiplexer {
    private static final Logger log = LoggerFactory.getLogger(ConnectionMultiplexer.class);

    private final ConnectionSettingsResolver resolver;
    private final ConnectionPoolFactory poolFactory;
    private final SessionConnector sessionConnector;
    private final KernelProperties props;

    private final ConcurrentHashMap<ConnectionKey, JdbcTarget> targets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ConnectionKey, ConnectionPool> pools = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<SessionKey, SessionLease> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<SessionKey, Object> sessionLocks = new ConcurrentHashMap<>();

    record SessionKey(ConnectionKey key, String sessionId) {
    }

    public ConnectionMultiplexer(ConnectionSettingsResolver resolver,
                                 ConnectionPoolFactory poolFactory,
                                 SessionConnector sessionConnector,
                                 KernelProperties props) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
        this.sessionConnector = Objects.requireNonNull(sessionConnector, "sessionConnector");
        this.props = props == null ? KernelProperties.defaults() : props;
    }

    // ---- pooled ----

    /**
     * Borrow a connection from the pool for {@code profile.key()}, creating the pool on first use.
     *
     * @throws ConnectionException if the target cannot be resolved or no connection can be obtained
     */
    public PooledLease acquirePooled(ConnectionProfile profile) {
        Objects.requireNonNull(profile, "profile");
        ConnectionKey key = profile.key();
        ConnectionPool pool = pools.computeIfAbsent(key, k -> {
            log.info("Creating connection pool for {}", k);
            return poolFactory.create(k, target(profile), props.pool());
        });
        try {
            return new PooledLease(this, key, pool.borrow());
        } catch (SQLException e) {
            throw new ConnectionException("Failed to connect to " + key + ": " + e.getMessage(), e);
        }
    }

    /** Hand a pooled connection back. A second release of the same lease is a no-op. */
    public void release(PooledLease lease) {
        if (lease == null) return;
        if (!lease.markReleased()) {
            log.debug("Lease for {} already released", lease.key());
            return;
        }
        try {
            lease.rawConnection().close();
        } catch (SQLException e) {
            log.warn("Error returning connection for {} to its pool: {}", lease.key(), e.getMessage());
        }
    }

    // ---- sessions ----

    /**
     * Returns the live session lease for (profile key, session id), opening one if there is none or
     * the previous one died. Concurrent calls for the same pair get the same lease.
     *
     * @throws ConnectionException if a new connection has to be opened and that fails
     */
    public SessionLease acquireSession(ConnectionProfile profile, String sessionId) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(sessionId, "sessionId");
        SessionKey sk = new SessionKey(profile.key(), sessionId);

        while (true) {
            Object lock = sessionLocks.computeIfAbsent(sk, k -> new Object());
            synchronized (lock) {
                if (sessionLocks.get(sk) != lock) {
                    // dropped by a concurrent close; start over with the current lock
                    continue;
                }
                SessionLease existing = sessions.get(sk);
                if (existing != null) {
                    // a script is running on it right now, so it is not dead
                    if (existing.executionLock().isLocked()
                            || existing.isAlive(props.session().validationTimeout())) {
                        return existing;
                    }
                    log.info("Session {} is no longer alive; reconnecting", existing);
                    discard(sk, existing);
                }

                try {
                    Connection c = sessionConnector.connect(sk.key(), target(profile));
                    SessionLease lease = new SessionLease(sk.key(), sessionId, c);
                    sessions.put(sk, lease);
                    log.info("Opened session {}", lease);
                    return lease;
                } catch (SQLException e) {
                    throw new ConnectionException("Failed to open session " + sk.key() + ":" + sessionId
                            + ": " + e.getMessage(), e);
                } finally {
                    if (!sessions.containsKey(sk)) {
                        sessionLocks.remove(sk, lock);
                    }
                }
            }
        }
    }

    /** Closes the session lease for (profile key, session id), if any. */
    public boolean closeSession(ConnectionProfile profile, String sessionId) {
        Objects.requireNonNull(profile, "profile");
        SessionKey sk = new SessionKey(profile.key(), sessionId);
        SessionLease lease = sessions.remove(sk);
        if (lease == null) return false;
        if (lease.close()) {
            log.info("Closed session {}", lease);
        }
        dropLock(sk);
        return true;
    }

    /** Drops a session whose connection turned out to be broken; the next acquire reconnects. */
    public void evictSession(SessionLease lease) {
        if (lease == null) return;
        SessionKey sk = new SessionKey(lease.key(), lease.sessionId());
        discard(sk, lease);
        dropLock(sk);
    }

    private void discard(SessionKey sk, SessionLease lease) {
        sessions.remove(sk, lease);
        if (lease.close()) {
            log.info("Evicted session {}", lease);
        }
    }

    /** Forgets the per-pair lock once no session is registered for the pair. */
    private void dropLock(SessionKey sk) {
        Object lock = sessionLocks.get(sk);
        if (lock == null) return;
        synchronized (lock) {
            if (!sessions.containsKey(sk)) {
                sessionLocks.remove(sk, lock);
            }
        }
    }

    // ---- teardown ----

    /** Closes the pool, every session and the target (tunnel included) of one key. */
    public void closeAllForKey(ConnectionKey key) {
        Objects.requireNonNull(key, "key");

        ConnectionPool pool = pools.remove(key);
        if (pool != null) {
            try {
                pool.close();
                log.info("Closed connection pool for {}", key);
            } catch (RuntimeException e) {
                log.warn("Error closing connection pool for {}: {}", key, e.getMessage());
            }
        }

        for (Map.Entry<SessionKey, SessionLease> e : sessions.entrySet()) {
            if (e.getKey().key().equals(key) && sessions.remove(e.getKey(), e.getValue())) {
                e.getValue().close();
                dropLock(e.getKey());
            }
        }

        JdbcTarget target = targets.remove(key);
        if (target != null) {
            try {
                target.close();
            } catch (RuntimeException e) {
                log.warn("Error closing connection target for {}: {}", key, e.getMessage());
            }
        }
    }

    /** Closes everything opened for any database of the given profile. */
    public void closeAllForProfileId(String profileId) {
        Objects.requireNonNull(profileId, "profileId");
        for (ConnectionKey key : knownKeys()) {
            if (key.belongsTo(profileId)) {
                closeAllForKey(key);
            }
        }
    }

    public void closeAll() {
        Set<ConnectionKey> keys = knownKeys();
        for (ConnectionKey key : keys) {
            closeAllForKey(key);
        }
        sessionLocks.clear();
        if (!keys.isEmpty()) {
            log.info("Closed all connections ({} keys)", keys.size());
        }
    }

    // ---- introspection ----

    public int poolCount() {
        return pools.size();
    }

    public int sessionCount() {
        return sessions.size();
    }

    public List<ConnectionPool> pools() {
        return List.copyOf(pools.values());
    }

    int sessionLockCount() {
        return sessionLocks.size();
    }

    public boolean hasSession(ConnectionKey key, String sessionId) {
        return sessions.containsKey(new SessionKey(key, sessionId));
    }

    private JdbcTarget target(ConnectionProfile profile) {
        return targets.computeIfAbsent(profile.key(), k -> resolver.resolve(profile));
    }

    private Set<ConnectionKey> knownKeys() {
        Set<ConnectionKey> keys = new LinkedHashSet<>(pools.keySet());
        sessions.keySet().forEach(sk -> keys.add(sk.key()));
        keys.addAll(targets.keySet());
        return keys;
    }
}
