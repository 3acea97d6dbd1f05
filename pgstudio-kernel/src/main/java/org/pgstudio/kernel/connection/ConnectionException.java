package org.pgstudio.kernel.connection;

import org.pgstudio.kernel.KernelException;

/**
 * A pool, session or SSH tunnel could not be established.
 *
 * <p>Never retried by the kernel; the caller decides whether to try again.
 */
public class ConnectionException extends KernelException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
