package org.pgstudio.cursor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-pass sequence of {@link StreamBatch}es over an open cursor.
 *
 * <p>Batch N+1 is only fetched when the caller asks for it. The cursor is released when the
 * rows run out, when a fetch fails, or on {@link #close()}, whichever comes first.
 */
public final class CursorStream implements Iterator<StreamBatch>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CursorStream.class);

    private final Connection conn;
    private final PreparedStatement ps;
    private final ResultSet rs;
    private final List<FieldInfo> fields;
    private final int batchSize;
    private final boolean restoreAutoCommit;

    private SQLWarning warnings;
    private StreamBatch pending;
    private boolean exhausted;
    private boolean closed;
    private int batchNumber;
    private long totalRows;

    CursorStream(Connection conn,
                 PreparedStatement ps,
                 ResultSet rs,
                 List<FieldInfo> fields,
                 int batchSize,
                 boolean restoreAutoCommit) {
        this.conn = conn;
        this.ps = ps;
        this.rs = rs;
        this.fields = List.copyOf(fields);
        this.batchSize = batchSize;
        this.restoreAutoCommit = restoreAutoCommit;
    }

    public List<FieldInfo> fields() {
        return fields;
    }

    public int batchSize() {
        return batchSize;
    }

    public long totalRows() {
        return totalRows;
    }

    /**
     * Warnings (server notices) the cursor statement collected. Read when the cursor is released,
     * so this is null while the stream is still open.
     */
    public SQLWarning warnings() {
        return warnings;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) return true;
        if (exhausted || closed) return false;
        pending = fetch();
        return pending != null;
    }

    @Override
    public StreamBatch next() {
        if (!hasNext()) {
            throw new NoSuchElementException("cursor exhausted");
        }
        StreamBatch b = pending;
        pending = null;
        return b;
    }

    /** Sequential {@link Stream} view; closing the stream closes the cursor. */
    public Stream<StreamBatch> batches() {
        Spliterator<StreamBatch> sp = Spliterators.spliteratorUnknownSize(this,
                Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(sp, false).onClose(this::close);
    }

    private StreamBatch fetch() {
        List<List<Object>> rows = new ArrayList<>(batchSize);
        int columns = fields.size();
        try {
            while (rows.size() < batchSize && rs.next()) {
                List<Object> row = new ArrayList<>(columns);
                for (int i = 1; i <= columns; i++) {
                    row.add(rs.getObject(i));
                }
                rows.add(Collections.unmodifiableList(row));
            }
        } catch (SQLException e) {
            exhausted = true;
            close();
            throw new CursorException("Failed to fetch batch " + (batchNumber + 1) + " from cursor", e);
        }

        if (rows.isEmpty()) {
            exhausted = true;
            close();
            return null;
        }

        batchNumber++;
        totalRows += rows.size();
        boolean complete = rows.size() < batchSize;
        if (complete) {
            exhausted = true;
            close();
        }
        return new StreamBatch(rows, fields, batchNumber, batchNumber == 1, complete, totalRows);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        try {
            rs.close();
        } catch (SQLException e) {
            log.warn("Failed to close cursor result set: {}", e.getMessage());
        }
        try {
            warnings = ps.getWarnings();
        } catch (SQLException e) {
            log.debug("Could not read cursor notices: {}", e.getMessage());
        }
        try {
            ps.close();
        } catch (SQLException e) {
            log.warn("Failed to close cursor statement: {}", e.getMessage());
        }
        if (restoreAutoCommit) {
            try {
                // ends the read-only transaction that held the portal open
                conn.commit();
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                log.warn("Failed to restore autocommit after cursor: {}", e.getMessage());
            }
        }
        log.debug("Closed cursor after {} batch(es), {} row(s)", batchNumber, totalRows);
    }
}
