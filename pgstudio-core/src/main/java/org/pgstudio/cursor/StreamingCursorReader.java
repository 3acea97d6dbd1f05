package org.pgstudio.cursor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pulls a large SELECT through a server-side cursor in bounded batches.
 *
 * <p>The PostgreSQL driver only keeps a portal open (instead of materializing the whole result)
 * when autocommit is off and a fetch size is set, so the reader switches autocommit off for the
 * lifetime of the stream and restores it on close. A connection that is already inside a
 * transaction is left as it is: the cursor joins that transaction and never commits it.
 *
 * <p>Drivers do not always reflect a transaction opened with a plain {@code BEGIN} in
 * {@link Connection#getAutoCommit()}; callers that know better pass {@code inTransaction}
 * explicitly. Inside such a transaction with autocommit still on, the driver may buffer the
 * whole result; batches are delivered the same way.
 *
 * <p>The caller owns the {@link Connection}; the returned {@link CursorStream} owns the
 * statement and result set and must be closed (try-with-resources) even when abandoned early.
 */
public final class StreamingCursorReader {
    private static final Logger log = LoggerFactory.getLogger(StreamingCursorReader.class);

    private final int defaultBatchSize;

    public StreamingCursorReader() {
        this(StreamingPolicy.DEFAULT_BATCH_SIZE);
    }

    public StreamingCursorReader(int defaultBatchSize) {
        this.defaultBatchSize = defaultBatchSize <= 0 ? StreamingPolicy.DEFAULT_BATCH_SIZE : defaultBatchSize;
    }

    public CursorStream stream(Connection conn, String query) throws SQLException {
        return stream(conn, query, defaultBatchSize);
    }

    public CursorStream stream(Connection conn, String query, int batchSize) throws SQLException {
        Objects.requireNonNull(conn, "conn");
        return stream(conn, query, batchSize, !conn.getAutoCommit());
    }

    /**
     * @param inTransaction whether the connection already has an open transaction; if so
     *                      autocommit is not touched and nothing is committed on close
     */
    public CursorStream stream(Connection conn, String query, int batchSize, boolean inTransaction)
            throws SQLException {
        Objects.requireNonNull(conn, "conn");
        Objects.requireNonNull(query, "query");
        int size = batchSize <= 0 ? defaultBatchSize : batchSize;

        boolean restoreAutoCommit = !inTransaction && conn.getAutoCommit();
        if (restoreAutoCommit) {
            conn.setAutoCommit(false);
        }

        PreparedStatement ps = null;
        try {
            ps = conn.prepareStatement(stripTrailingSemicolon(query),
                    ResultSet.TYPE_FORWARD_ONLY,
                    ResultSet.CONCUR_READ_ONLY);
            ps.setFetchSize(size);
            ResultSet rs = ps.executeQuery();
            List<FieldInfo> fields = fields(rs.getMetaData());
            log.debug("Opened cursor batchSize={} columns={}", size, fields.size());
            return new CursorStream(conn, ps, rs, fields, size, restoreAutoCommit);
        } catch (SQLException e) {
            if (ps != null) {
                try {
                    ps.close();
                } catch (SQLException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            if (restoreAutoCommit) {
                try {
                    conn.rollback();
                    conn.setAutoCommit(true);
                } catch (SQLException restoreFailure) {
                    e.addSuppressed(restoreFailure);
                }
            }
            throw e;
        }
    }

    static List<FieldInfo> fields(ResultSetMetaData md) throws SQLException {
        int n = md.getColumnCount();
        List<FieldInfo> fields = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) {
            fields.add(new FieldInfo(md.getColumnLabel(i), md.getColumnType(i), md.getColumnTypeName(i)));
        }
        return fields;
    }

    private static String stripTrailingSemicolon(String query) {
        String q = query.trim();
        while (q.endsWith(";")) {
            q = q.substring(0, q.length() - 1).trim();
        }
        return q;
    }
}
