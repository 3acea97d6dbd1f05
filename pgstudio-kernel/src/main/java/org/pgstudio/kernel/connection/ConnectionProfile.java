package org.pgstudio.kernel.connection;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything needed to reach one PostgreSQL server.
 *
 * <p>The password is deliberately absent: it is looked up by {@link #id()} in a
 * {@link org.pgstudio.kernel.secret.SecretStore} when a connection is built.
 */
public record ConnectionProfile(
        String id,
        String name,
        String host,
        int port,
        String username,
        String database,
        SslMode sslMode,
        String sslRootCertPath,
        String sslCertPath,
        String sslKeyPath,
        Duration statementTimeout,
        Duration connectTimeout,
        String applicationName,
        String options,
        SshTunnelDescriptor ssh
) {
    public static final String DEFAULT_DATABASE = "postgres";
    public static final int DEFAULT_PORT = 5432;
    public static final String DEFAULT_APPLICATION_NAME = "PgStudio";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    public ConnectionProfile {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("profile id must not be blank");
        host = isBlank(host) ? "localhost" : host;
        port = port <= 0 ? DEFAULT_PORT : port;
        database = isBlank(database) ? DEFAULT_DATABASE : database;
        sslMode = sslMode == null ? SslMode.DISABLE : sslMode;
        connectTimeout = connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()
                ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        applicationName = isBlank(applicationName) ? DEFAULT_APPLICATION_NAME : applicationName;
    }

    /** Minimal profile: plain TCP, no TLS, default timeouts. */
    public static ConnectionProfile of(String id, String host, int port, String username, String database) {
        return new ConnectionProfile(id, null, host, port, username, database,
                SslMode.DISABLE, null, null, null, null, null, null, null, null);
    }

    public ConnectionKey key() {
        return new ConnectionKey(id, database);
    }

    /** Same server and credentials, different database. Blank keeps the current one. */
    public ConnectionProfile withDatabase(String db) {
        if (isBlank(db) || db.equals(database)) return this;
        return new ConnectionProfile(id, name, host, port, username, db, sslMode, sslRootCertPath,
                sslCertPath, sslKeyPath, statementTimeout, connectTimeout, applicationName, options, ssh);
    }

    public ConnectionProfile withSsh(SshTunnelDescriptor tunnel) {
        return new ConnectionProfile(id, name, host, port, username, database, sslMode, sslRootCertPath,
                sslCertPath, sslKeyPath, statementTimeout, connectTimeout, applicationName, options, tunnel);
    }

    public boolean sshEnabled() {
        return ssh != null && ssh.enabled();
    }

    public String displayName() {
        return isBlank(name) ? host : name;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
