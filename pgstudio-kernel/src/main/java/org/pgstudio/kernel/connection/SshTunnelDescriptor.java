package org.pgstudio.kernel.connection;

/**
 * Where to open an SSH tunnel before reaching the database.
 *
 * <p>Key material is never read here: {@code privateKeyPath} is handed to the
 * {@link org.pgstudio.kernel.connection.spi.SshTunnelProvider} as-is.
 */
public record SshTunnelDescriptor(
        boolean enabled,
        String host,
        int port,
        String username,
        String privateKeyPath
) {
    public SshTunnelDescriptor {
        port = port <= 0 ? 22 : port;
    }

    @Override
    public String toString() {
        return "ssh://" + username + "@" + host + ":" + port;
    }
}
