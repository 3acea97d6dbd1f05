package org.pgstudio.kernel.config;

import org.pgstudio.kernel.connection.ConnectionProfile;
import org.pgstudio.kernel.connection.SshTunnelDescriptor;
import org.pgstudio.kernel.connection.SslMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection profiles and their passwords.
 * <p>
 * Passwords live apart from the profiles ({@code pgstudio.secrets.passwords.<id>}) so they can come
 * from environment variables while the profiles stay in YAML.
 */
@ConfigurationProperties(prefix = "pgstudio")
public class ConnectionProfilesProperties {

    /** Map of profile id -> connection settings. */
    private Map<String, ProfileConfig> connections = new HashMap<>();

    private Secrets secrets = new Secrets();

    public Map<String, ProfileConfig> getConnections() {
        return connections;
    }

    public void setConnections(Map<String, ProfileConfig> connections) {
        this.connections = connections;
    }

    public Secrets getSecrets() {
        return secrets;
    }

    public void setSecrets(Secrets secrets) {
        this.secrets = secrets;
    }

    public List<ConnectionProfile> toProfiles() {
        List<ConnectionProfile> out = new ArrayList<>();
        if (connections == null) return out;
        connections.forEach((id, cfg) -> {
            if (id != null && cfg != null) out.add(cfg.toProfile(id));
        });
        return out;
    }

    public static class Secrets {

        /** profile id -> password. Prefer PGSTUDIO_SECRETS_PASSWORDS_<ID> over YAML. */
        private Map<String, String> passwords = new HashMap<>();

        public Map<String, String> getPasswords() {
            return passwords;
        }

        public void setPasswords(Map<String, String> passwords) {
            this.passwords = passwords;
        }
    }

    public static class ProfileConfig {

        private String name;
        private String host = "localhost";
        private int port = ConnectionProfile.DEFAULT_PORT;
        private String username;
        private String database = ConnectionProfile.DEFAULT_DATABASE;
        private SslMode sslMode = SslMode.DISABLE;
        private String sslRootCertPath;
        private String sslCertPath;
        private String sslKeyPath;

        /** Applied per connection as {@code -c statement_timeout=...}. */
        private Duration statementTimeout;
        private Duration connectTimeout = ConnectionProfile.DEFAULT_CONNECT_TIMEOUT;
        private String applicationName = ConnectionProfile.DEFAULT_APPLICATION_NAME;

        /** Raw server options, e.g. {@code -c search_path=app}. */
        private String options;

        private SshConfig ssh;

        public ConnectionProfile toProfile(String id) {
            SshTunnelDescriptor tunnel = ssh == null ? null
                    : new SshTunnelDescriptor(ssh.isEnabled(), ssh.getHost(), ssh.getPort(),
                    ssh.getUsername(), ssh.getPrivateKeyPath());
            return new ConnectionProfile(id, name, host, port, username, database, sslMode,
                    sslRootCertPath, sslCertPath, sslKeyPath, statementTimeout, connectTimeout,
                    applicationName, options, tunnel);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public SslMode getSslMode() {
            return sslMode;
        }

        public void setSslMode(SslMode sslMode) {
            this.sslMode = sslMode;
        }

        public String getSslRootCertPath() {
            return sslRootCertPath;
        }

        public void setSslRootCertPath(String sslRootCertPath) {
            this.sslRootCertPath = sslRootCertPath;
        }

        public String getSslCertPath() {
            return sslCertPath;
        }

        public void setSslCertPath(String sslCertPath) {
            this.sslCertPath = sslCertPath;
        }

        public String getSslKeyPath() {
            return sslKeyPath;
        }

        public void setSslKeyPath(String sslKeyPath) {
            this.sslKeyPath = sslKeyPath;
        }

        public Duration getStatementTimeout() {
            return statementTimeout;
        }

        public void setStatementTimeout(Duration statementTimeout) {
            this.statementTimeout = statementTimeout;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public String getApplicationName() {
            return applicationName;
        }

        public void setApplicationName(String applicationName) {
            this.applicationName = applicationName;
        }

        public String getOptions() {
            return options;
        }

        public void setOptions(String options) {
            this.options = options;
        }

        public SshConfig getSsh() {
            return ssh;
        }

        public void setSsh(SshConfig ssh) {
            this.ssh = ssh;
        }
    }

    public static class SshConfig {

        private boolean enabled;
        private String host;
        private int port = 22;
        private String username;

        /** Passed to the tunnel provider untouched; never read by the kernel. */
        private String privateKeyPath;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPrivateKeyPath() {
            return privateKeyPath;
        }

        public void setPrivateKeyPath(String privateKeyPath) {
            this.privateKeyPath = privateKeyPath;
        }
    }
}
