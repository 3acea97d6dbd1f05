package org.pgstudio.kernel.connection.spi;

import org.pgstudio.kernel.connection.SshTunnelDescriptor;

/**
 * Pluggable SSH tunnel implementation.
 *
 * <p>Key file handling and the SSH client library live behind this SPI so the kernel never
 * touches key material. Providers can be Spring beans or {@link java.util.ServiceLoader}
 * registrations.
 */
public interface SshTunnelProvider {

    /** A stable provider ID (e.g. "jsch", "mina", "corp-bastion"). */
    String id();

    /** Open a forward from a local port to {@code targetHost:targetPort} through the SSH host. */
    SshTunnel open(SshTunnelDescriptor ssh, String targetHost, int targetPort) throws Exception;
}
