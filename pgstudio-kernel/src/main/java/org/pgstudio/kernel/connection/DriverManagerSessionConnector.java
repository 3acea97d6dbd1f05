package org.pgstudio.kernel.connection;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/** Session connections straight from the driver, outside any pool. */
public class DriverManagerSessionConnector implements SessionConnector {

    @Override
    public Connection connect(ConnectionKey key, JdbcTarget target) throws SQLException {
        return DriverManager.getConnection(target.url(), target.toProperties());
    }
}
