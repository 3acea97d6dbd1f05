package org.pgstudio.kernel.connection;

import org.pgstudio.kernel.connection.spi.SshTunnel;
import org.pgstudio.kernel.connection.spi.SshTunnelFactory;
import org.pgstudio.kernel.secret.SecretStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Turns a {@link ConnectionProfile} into a {@link JdbcTarget} for the PostgreSQL driver.
 *
 * <p>TLS files that cannot be read are logged and left out rather than failing the connection;
 * the driver then falls back to its default trust material for the requested {@code sslmode}.
 * SSH tunnel failures are not lenient and surface as {@link ConnectionException}.
 */
public class ConnectionSettingsResolver {
    private static final Logger log = LoggerFactory.getLogger(ConnectionSettingsResolver.class);

    private final SecretStore secrets;
    private final SshTunnelFactory tunnels;

    public ConnectionSettingsResolver(SecretStore secrets, SshTunnelFactory tunnels) {
        this.secrets = Objects.requireNonNull(secrets, "secrets");
        this.tunnels = Objects.requireNonNull(tunnels, "tunnels");
    }

    public JdbcTarget resolve(ConnectionProfile profile) {
        Objects.requireNonNull(profile, "profile");
        Map<String, String> props = new LinkedHashMap<>();

        if (profile.username() != null && !profile.username().isBlank()) {
            props.put("user", profile.username());
            secrets.password(profile.id()).ifPresent(pw -> props.put("password", pw));
        }

        props.put("sslmode", profile.sslMode().driverValue());
        if (profile.sslMode().encrypted()) {
            putReadable(props, "sslrootcert", profile.sslRootCertPath(), "SSL CA");
            putReadable(props, "sslcert", profile.sslCertPath(), "SSL Cert");
            putReadable(props, "sslkey", profile.sslKeyPath(), "SSL Key");
        }

        props.put("connectTimeout", Long.toString(Math.max(1, profile.connectTimeout().toSeconds())));
        props.put("ApplicationName", profile.applicationName());

        String options = serverOptions(profile);
        if (!options.isEmpty()) {
            props.put("options", options);
        }

        String host = profile.host();
        int port = profile.port();
        SshTunnel tunnel = null;
        if (profile.sshEnabled()) {
            tunnel = tunnels.open(profile.ssh(), profile.host(), profile.port());
            host = tunnel.localHost();
            port = tunnel.localPort();
        }

        String url = "jdbc:postgresql://" + host + ":" + port + "/"
                + URLEncoder.encode(profile.database(), StandardCharsets.UTF_8);
        JdbcTarget target = new JdbcTarget(url, props, tunnel);
        log.debug("Resolved {} for {}", target, profile.key());
        return target;
    }

    static String serverOptions(ConnectionProfile profile) {
        StringJoiner sj = new StringJoiner(" ");
        if (profile.statementTimeout() != null && !profile.statementTimeout().isNegative()
                && !profile.statementTimeout().isZero()) {
            sj.add("-c statement_timeout=" + profile.statementTimeout().toMillis());
        }
        if (profile.options() != null && !profile.options().isBlank()) {
            sj.add(profile.options().trim());
        }
        return sj.toString();
    }

    private static void putReadable(Map<String, String> props, String key, String path, String label) {
        if (path == null || path.isBlank()) return;
        try {
            Path p = Path.of(path);
            if (Files.isReadable(p) && Files.isRegularFile(p)) {
                props.put(key, p.toString());
                return;
            }
            log.warn("Failed to read {} at {}; continuing without it", label, path);
        } catch (InvalidPathException e) {
            log.warn("Failed to read {} at {}: {}; continuing without it", label, path, e.getMessage());
        }
    }
}
