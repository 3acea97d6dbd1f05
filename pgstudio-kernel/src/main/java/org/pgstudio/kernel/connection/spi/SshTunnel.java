package org.pgstudio.kernel.connection.spi;

/**
 * An open SSH port forward. The driver connects to {@link #localHost()}:{@link #localPort()}
 * instead of the database host.
 */
public interface SshTunnel extends AutoCloseable {

    String localHost();

    int localPort();

    boolean isOpen();

    /** Closes the forward and the SSH session behind it. */
    @Override
    void close();
}
