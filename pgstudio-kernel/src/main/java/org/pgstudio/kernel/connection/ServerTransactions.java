package org.pgstudio.kernel.connection;

import org.postgresql.core.BaseConnection;
import org.postgresql.core.TransactionState;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Whether a connection is inside a transaction, as the server sees it.
 *
 * <p>A {@code BEGIN} sent as SQL text does not change the driver's autocommit flag, so the flag
 * alone cannot tell. For PostgreSQL connections the driver's tracked transaction state is used;
 * other drivers fall back to the autocommit flag.
 */
public final class ServerTransactions {

    private ServerTransactions() {}

    public static boolean isOpen(Connection conn) throws SQLException {
        if (!conn.getAutoCommit()) return true;
        if (conn.isWrapperFor(BaseConnection.class)) {
            return conn.unwrap(BaseConnection.class).getTransactionState() != TransactionState.IDLE;
        }
        return false;
    }
}
