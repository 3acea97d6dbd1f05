package org.pgstudio.kernel.connection;

import org.pgstudio.kernel.connection.spi.SshTunnel;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Resolved connection factory for one {@link ConnectionKey}: driver URL, driver properties and,
 * when the profile goes through SSH, the tunnel the URL points at.
 */
public final class JdbcTarget implements AutoCloseable {

    private final String url;
    private final Map<String, String> properties;
    private final SshTunnel tunnel;

    public JdbcTarget(String url, Map<String, String> properties, SshTunnel tunnel) {
        this.url = Objects.requireNonNull(url, "url");
        this.properties = Map.copyOf(properties);
        this.tunnel = tunnel;
    }

    public String url() {
        return url;
    }

    public Map<String, String> properties() {
        return properties;
    }

    public boolean tunneled() {
        return tunnel != null;
    }

    public Properties toProperties() {
        Properties p = new Properties();
        p.putAll(properties);
        return p;
    }

    @Override
    public void close() {
        if (tunnel != null) {
            tunnel.close();
        }
    }

    @Override
    public String toString() {
        // never print the password
        return "JdbcTarget{url=" + url + ", propertyKeys=" + properties.keySet() + ", tunneled=" + tunneled() + "}";
    }
}
