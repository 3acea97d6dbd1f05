package org.pgstudio.kernel.connection;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.pgstudio.kernel.config.KernelProperties;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * HikariCP pools: bounded, idle connections above the idle timeout are retired, nothing is kept
 * warm ({@code minimumIdle=0}).
 *
 * <p>The pool starts without a connectivity check so an unreachable server surfaces on the first
 * borrow rather than at construction. Broken idle connections are logged by Hikari and replaced;
 * they never tear the pool down.
 */
public class HikariConnectionPoolFactory implements ConnectionPoolFactory {

    @Override
    public ConnectionPool create(ConnectionKey key, JdbcTarget target, KernelProperties.Pool settings) {
        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("pgstudio-" + key);
        cfg.setJdbcUrl(target.url());
        cfg.setDataSourceProperties(target.toProperties());
        cfg.setMaximumPoolSize(settings.maxSize());
        cfg.setMinimumIdle(0);
        cfg.setIdleTimeout(settings.idleTimeout().toMillis());
        cfg.setConnectionTimeout(settings.connectionTimeout().toMillis());
        cfg.setInitializationFailTimeout(-1);

        return new HikariConnectionPool(key, new HikariDataSource(cfg));
    }

    static final class HikariConnectionPool implements ConnectionPool {
        private final ConnectionKey key;
        private final HikariDataSource dataSource;

        HikariConnectionPool(ConnectionKey key, HikariDataSource dataSource) {
            this.key = key;
            this.dataSource = dataSource;
        }

        @Override
        public ConnectionKey key() {
            return key;
        }

        @Override
        public Connection borrow() throws SQLException {
            return dataSource.getConnection();
        }

        @Override
        public int activeConnections() {
            HikariPoolMXBean mx = dataSource.getHikariPoolMXBean();
            return mx == null ? 0 : mx.getActiveConnections();
        }

        @Override
        public int idleConnections() {
            HikariPoolMXBean mx = dataSource.getHikariPoolMXBean();
            return mx == null ? 0 : mx.getIdleConnections();
        }

        @Override
        public void close() {
            dataSource.close();
        }
    }
}
