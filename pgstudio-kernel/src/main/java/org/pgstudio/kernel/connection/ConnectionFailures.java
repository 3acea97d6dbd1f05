package org.pgstudio.kernel.connection;

import java.sql.SQLException;
import java.util.Set;

/** Classifies SQL errors that mean the connection itself is gone. */
public final class ConnectionFailures {

    // admin_shutdown, crash_shutdown, cannot_connect_now
    private static final Set<String> SHUTDOWN_STATES = Set.of("57P01", "57P02", "57P03");

    private ConnectionFailures() {
    }

    public static boolean isConnectionFailure(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            String state = cur.getSQLState();
            if (state == null) continue;
            if (state.startsWith("08") || SHUTDOWN_STATES.contains(state)) return true;
        }
        return false;
    }
}
