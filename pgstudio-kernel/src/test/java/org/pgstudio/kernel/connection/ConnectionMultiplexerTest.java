package org.pgstudio.kernel.connection;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pgstudio.kernel.config.KernelProperties;
import org.pgstudio.kernel.connection.spi.SshTunnelFactory;
import org.pgstudio.kernel.secret.ConfiguredSecretStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConnectionMultiplexerTest {

    private final ConnectionProfile alpha = ConnectionProfile.of("alpha", "h", 5432, "app", "sales");
    private final ConnectionProfile beta = ConnectionProfile.of("beta", "h", 5432, "app", "sales");

    private FakeConnectionPoolFactory pools;
    private AtomicInteger sessionConnects;
    private List<Connection> sessionConnections;
    private ConnectionMultiplexer mux;

    @BeforeEach
    void setUp() {
        pools = FakeConnectionPoolFactory.of(() -> mock(Connection.class));
        sessionConnects = new AtomicInteger();
        sessionConnections = new ArrayList<>();
        mux = multiplexer(pools, (key, target) -> {
            sessionConnects.incrementAndGet();
            Connection c = liveConnection();
            synchronized (sessionConnections) {
                sessionConnections.add(c);
            }
            return c;
        });
    }

    @AfterEach
    void tearDown() {
        mux.closeAll();
    }

    private static ConnectionMultiplexer multiplexer(ConnectionPoolFactory poolFactory, SessionConnector connector) {
        ConnectionSettingsResolver resolver = new ConnectionSettingsResolver(
                new ConfiguredSecretStore(Map.of()), new SshTunnelFactory(List.of(), null));
        return new ConnectionMultiplexer(resolver, poolFactory, connector, KernelProperties.defaults());
    }

    private static Connection liveConnection() {
        Connection c = mock(Connection.class);
        try {
            when(c.isValid(anyInt())).thenReturn(true);
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
        return c;
    }

    @Test
    void samePoolIsReusedForTheSameKey() {
        try (PooledLease a = mux.acquirePooled(alpha);
             PooledLease b = mux.acquirePooled(alpha)) {
            assertThat(a.key()).isEqualTo(b.key());
        }
        try (PooledLease other = mux.acquirePooled(alpha.withDatabase("hr"))) {
            assertThat(other.key()).hasToString("alpha:hr");
        }

        assertThat(pools.created).hasSize(2);
        assertThat(pools.created.get(0).borrowed).hasValue(2);
        assertThat(mux.poolCount()).isEqualTo(2);
    }

    @Test
    void leaseIsReleasedExactlyOnce() throws Exception {
        PooledLease lease = mux.acquirePooled(alpha);
        Connection c = lease.connection();

        lease.close();
        lease.close();
        mux.release(lease);

        verify(c, times(1)).close();
        assertThat(lease.isReleased()).isTrue();
        assertThatThrownBy(lease::connection).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void borrowFailureSurfacesAsConnectionException() {
        FakeConnectionPoolFactory failing = new FakeConnectionPoolFactory(() -> {
            throw new SQLException("Connection refused", "08001");
        });
        ConnectionMultiplexer m = multiplexer(failing, (key, target) -> liveConnection());

        assertThatThrownBy(() -> m.acquirePooled(alpha))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("alpha:sales")
                .hasMessageContaining("Connection refused");
        // the pool itself stays usable for the next attempt
        assertThat(m.poolCount()).isEqualTo(1);
        m.closeAll();
    }

    @Test
    void sessionIsReusedForTheSamePair() {
        SessionLease first = mux.acquireSession(alpha, "nb-1");
        SessionLease again = mux.acquireSession(alpha, "nb-1");
        SessionLease otherSession = mux.acquireSession(alpha, "nb-2");
        SessionLease otherDb = mux.acquireSession(alpha.withDatabase("hr"), "nb-1");

        assertThat(again).isSameAs(first);
        assertThat(otherSession).isNotSameAs(first);
        assertThat(otherDb).isNotSameAs(first);
        assertThat(sessionConnects).hasValue(3);
        assertThat(mux.sessionCount()).isEqualTo(3);
        assertThat(mux.hasSession(alpha.key(), "nb-1")).isTrue();
    }

    @Test
    void concurrentRequestsForOnePairOpenOneConnection() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger connects = new AtomicInteger();
        ConnectionMultiplexer m = multiplexer(pools, (key, target) -> {
            connects.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return liveConnection();
        });

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<SessionLease>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<SessionLease> task = () -> {
                    gate.await();
                    return m.acquireSession(alpha, "shared");
                };
                futures.add(pool.submit(task));
            }
            gate.countDown();

            Set<SessionLease> distinct = ConcurrentHashMap.newKeySet();
            for (Future<SessionLease> f : futures) {
                distinct.add(f.get(5, TimeUnit.SECONDS));
            }
            assertThat(distinct).hasSize(1);
            assertThat(connects).hasValue(1);
        } finally {
            pool.shutdownNow();
            m.closeAll();
        }
    }

    @Test
    void deadSessionIsEvictedAndReopened() throws Exception {
        SessionLease first = mux.acquireSession(alpha, "nb-1");
        when(first.connection().isValid(anyInt())).thenReturn(false);

        SessionLease second = mux.acquireSession(alpha, "nb-1");

        assertThat(second).isNotSameAs(first);
        assertThat(first.isClosed()).isTrue();
        verify(first.connection()).close();
        assertThat(sessionConnects).hasValue(2);
        assertThat(mux.sessionCount()).isEqualTo(1);
    }

    @Test
    void busySessionIsNotValidated() throws Exception {
        SessionLease first = mux.acquireSession(alpha, "nb-1");
        first.executionLock().lock();
        try {
            SessionLease again = mux.acquireSession(alpha, "nb-1");
            assertThat(again).isSameAs(first);
            verify(first.connection(), never()).isValid(anyInt());
        } finally {
            first.executionLock().unlock();
        }
    }

    @Test
    void sessionConnectFailureIsNotRegistered() {
        ConnectionMultiplexer m = multiplexer(pools, (key, target) -> {
            throw new SQLException("password authentication failed", "28P01");
        });

        assertThatThrownBy(() -> m.acquireSession(alpha, "nb-1"))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("password authentication failed");
        assertThat(m.sessionCount()).isZero();
        m.closeAll();
    }

    @Test
    void closeSessionClosesOnlyThatSession() throws Exception {
        SessionLease one = mux.acquireSession(alpha, "nb-1");
        SessionLease two = mux.acquireSession(alpha, "nb-2");

        assertThat(mux.closeSession(alpha, "nb-1")).isTrue();
        assertThat(mux.closeSession(alpha, "nb-1")).isFalse();

        verify(one.connection()).close();
        verify(two.connection(), never()).close();
        assertThat(mux.sessionCount()).isEqualTo(1);
    }

    @Test
    void evictingAReplacedLeaseKeepsTheCurrentOne() {
        SessionLease current = mux.acquireSession(alpha, "nb-1");
        mux.evictSession(current);
        SessionLease replacement = mux.acquireSession(alpha, "nb-1");

        mux.evictSession(current);

        assertThat(mux.hasSession(alpha.key(), "nb-1")).isTrue();
        assertThat(replacement.isClosed()).isFalse();
    }

    @Test
    void closeAllForProfileIdLeavesOtherProfilesAlone() throws Exception {
        mux.acquirePooled(alpha).close();
        mux.acquirePooled(alpha.withDatabase("hr")).close();
        mux.acquirePooled(beta).close();
        SessionLease alphaSession = mux.acquireSession(alpha, "nb-1");
        SessionLease betaSession = mux.acquireSession(beta, "nb-1");

        mux.closeAllForProfileId("alpha");

        assertThat(pools.created.get(0).closed).hasValue(1);
        assertThat(pools.created.get(1).closed).hasValue(1);
        assertThat(pools.created.get(2).closed).hasValue(0);
        assertThat(alphaSession.isClosed()).isTrue();
        assertThat(betaSession.isClosed()).isFalse();
        assertThat(mux.poolCount()).isEqualTo(1);
        assertThat(mux.sessionCount()).isEqualTo(1);
    }

    @Test
    void closeAllClosesEverythingExactlyOnce() throws Exception {
        mux.acquirePooled(alpha).close();
        mux.acquirePooled(beta).close();
        mux.acquireSession(alpha, "nb-1");
        mux.acquireSession(beta, "nb-2");

        mux.closeAll();
        mux.closeAll();

        assertThat(pools.created).allSatisfy(p -> assertThat(p.closed).hasValue(1));
        for (Connection c : sessionConnections) {
            verify(c, times(1)).close();
        }
        assertThat(mux.poolCount()).isZero();
        assertThat(mux.sessionCount()).isZero();
    }

    @Test
    void resourcesAreRecreatedAfterClose() {
        mux.acquirePooled(alpha).close();
        mux.closeAllForKey(alpha.key());
        mux.acquirePooled(alpha).close();

        assertThat(pools.created).hasSize(2);
    }

    @Test
    void sessionLocksGoAwayWithTheirSessions() {
        for (int i = 0; i < 500; i++) {
            mux.acquireSession(alpha, "nb-" + i);
            assertThat(mux.closeSession(alpha, "nb-" + i)).isTrue();
        }

        assertThat(mux.sessionCount()).isZero();
        assertThat(mux.sessionLockCount()).isZero();
    }

    @Test
    void evictionAndProfileCloseForgetSessionLocks() {
        SessionLease evicted = mux.acquireSession(alpha, "nb-1");
        mux.acquireSession(alpha.withDatabase("hr"), "nb-2");
        mux.acquireSession(beta, "nb-3");

        mux.evictSession(evicted);
        assertThat(mux.sessionLockCount()).isEqualTo(2);

        mux.closeAllForProfileId("alpha");
        assertThat(mux.sessionLockCount()).isEqualTo(1);
        assertThat(mux.hasSession(beta.key(), "nb-3")).isTrue();
    }

    @Test
    void failedConnectLeavesNoLockBehind() {
        ConnectionMultiplexer m = multiplexer(pools, (key, target) -> {
            throw new SQLException("Connection refused", "08001");
        });

        for (int i = 0; i < 10; i++) {
            String id = "nb-" + i;
            assertThatThrownBy(() -> m.acquireSession(alpha, id)).isInstanceOf(ConnectionException.class);
        }

        assertThat(m.sessionLockCount()).isZero();
        m.closeAll();
    }

    @Test
    void sessionIsReopenedAfterItsLockWasDropped() {
        SessionLease first = mux.acquireSession(alpha, "nb-1");
        mux.closeSession(alpha, "nb-1");

        SessionLease second = mux.acquireSession(alpha, "nb-1");

        assertThat(second).isNotSameAs(first);
        assertThat(mux.sessionLockCount()).isEqualTo(1);
        assertThat(sessionConnects).hasValue(2);
    }
}
