package org.pgstudio.kernel.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects server notices ({@code RAISE NOTICE}, implicit-index messages, ...) for the statement
 * that produced them.
 *
 * <p>The PostgreSQL driver reports notices as {@link SQLWarning}s on the statement and the
 * connection. Opening a capture clears whatever is pending; {@link #drain(Statement)} takes the
 * notices of one statement; closing clears the connection again so nothing leaks into the next
 * script on the same session.
 */
final class NoticeCapture implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NoticeCapture.class);

    private final Connection conn;

    private NoticeCapture(Connection conn) {
        this.conn = conn;
    }

    static NoticeCapture open(Connection conn) {
        NoticeCapture capture = new NoticeCapture(Objects.requireNonNull(conn, "conn"));
        capture.clearConnection();
        return capture;
    }

    /** @param stmt the statement just executed; may be null if it is already closed */
    List<String> drain(Statement stmt) {
        List<String> out = new ArrayList<>();
        if (stmt != null) {
            try {
                collect(stmt.getWarnings(), out);
                stmt.clearWarnings();
            } catch (SQLException e) {
                log.debug("Could not read statement notices: {}", e.getMessage());
            }
        }
        return drainConnection(out);
    }

    /** For statements closed before their notices could be read, e.g. a finished cursor. */
    List<String> drainWith(SQLWarning statementWarnings) {
        List<String> out = new ArrayList<>();
        collect(statementWarnings, out);
        return drainConnection(out);
    }

    private List<String> drainConnection(List<String> out) {
        try {
            collect(conn.getWarnings(), out);
        } catch (SQLException e) {
            log.debug("Could not read connection notices: {}", e.getMessage());
        }
        clearConnection();
        return out;
    }

    @Override
    public void close() {
        clearConnection();
    }

    private void clearConnection() {
        try {
            if (!conn.isClosed()) {
                conn.clearWarnings();
            }
        } catch (SQLException e) {
            log.debug("Could not clear connection notices: {}", e.getMessage());
        }
    }

    private static void collect(SQLWarning warning, List<String> out) {
        SQLWarning w = warning;
        while (w != null) {
            String msg = w.getMessage();
            if (msg != null && !msg.isBlank()) {
                out.add(msg);
            }
            w = w.getNextWarning();
        }
    }
}
