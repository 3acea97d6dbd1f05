package org.pgstudio.kernel.connection;

import java.sql.Connection;
import java.sql.SQLException;

/** A bounded pool of connections for one {@link ConnectionKey}. */
public interface ConnectionPool extends AutoCloseable {

    ConnectionKey key();

    /** Borrow a connection; closing it hands it back to the pool. */
    Connection borrow() throws SQLException;

    int activeConnections();

    int idleConnections();

    @Override
    void close();
}
