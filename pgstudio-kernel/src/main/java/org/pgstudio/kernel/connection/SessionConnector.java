package org.pgstudio.kernel.connection;

import java.sql.Connection;
import java.sql.SQLException;

/** Opens the single dedicated connection behind a session lease. */
@FunctionalInterface
public interface SessionConnector {

    Connection connect(ConnectionKey key, JdbcTarget target) throws SQLException;
}
