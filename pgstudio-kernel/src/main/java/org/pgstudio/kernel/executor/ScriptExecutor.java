package org.pgstudio.kernel.executor;

import org.pgstudio.cursor.CursorException;
import org.pgstudio.cursor.CursorStream;
import org.pgstudio.cursor.FieldInfo;
import org.pgstudio.cursor.StreamingCursorReader;
import org.pgstudio.cursor.StreamingPolicy;
import org.pgstudio.kernel.cancel.CancellationController;
import org.pgstudio.kernel.cancel.CancellationResult;
import org.pgstudio.kernel.config.KernelProperties;
import org.pgstudio.kernel.connection.ConnectionFailures;
import org.pgstudio.kernel.connection.ConnectionKey;
import org.pgstudio.kernel.connection.ConnectionMultiplexer;
import org.pgstudio.kernel.connection.ConnectionProfile;
import org.pgstudio.kernel.connection.ServerTransactions;
import org.pgstudio.kernel.connection.SessionLease;
import org.pgstudio.kernel.history.HistoryEntry;
import org.pgstudio.kernel.history.QueryHistorySink;
import org.pgstudio.sql.StatementSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Runs multi-statement SQL scripts on a session connection.
 *
 * <p>A script is split with {@link StatementSplitter} and its statements run strictly in order on
 * the {@link SessionLease} for (profile, session id), so session state set by one statement is
 * visible to the next and to later scripts. The first failing statement stops the script; the
 * session stays usable unless the failure means the connection itself is gone, in which case it
 * is evicted and the next script reconnects.
 */
public class ScriptExecutor {
    private static final Logger log = LoggerFactory.getLogger(ScriptExecutor.class);

    private static final String CHANGES_SAVEPOINT = "pgstudio_changes";

    private final ConnectionMultiplexer connections;
    private final QueryHistorySink history;
    private final StreamingCursorReader cursorReader;
    private final StreamingPolicy streamingPolicy;
    private final CancellationController cancellation;
    private final Executor workers;
    private final KernelProperties props;
    private final TableInfoResolver tableInfo = new TableInfoResolver();

    public ScriptExecutor(ConnectionMultiplexer connections,
                          QueryHistorySink history,
                          StreamingCursorReader cursorReader,
                          StreamingPolicy streamingPolicy,
                          CancellationController cancellation,
                          Executor workers,
                          KernelProperties props) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.history = Objects.requireNonNull(history, "history");
        this.cursorReader = Objects.requireNonNull(cursorReader, "cursorReader");
        this.streamingPolicy = Objects.requireNonNull(streamingPolicy, "streamingPolicy");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.props = props == null ? KernelProperties.defaults() : props;
    }

    /**
     * Runs {@code script} on the calling thread. Progress is reported through {@code listener} as
     * each statement finishes.
     *
     * @throws org.pgstudio.kernel.connection.ConnectionException if the session cannot be opened
     */
    public ScriptReport execute(String script, ConnectionProfile profile, String sessionId, ScriptListener listener) {
        return run(script, profile, sessionId, listener, pid -> { });
    }

    /** Runs {@code script} on a worker thread; the handle can cancel the running statement. */
    public ScriptExecutionHandle submit(String script, ConnectionProfile profile, String sessionId,
                                       ScriptListener listener) {
        Objects.requireNonNull(profile, "profile");
        BackgroundScript handle = new BackgroundScript(profile, cancellation);
        CompletableFuture.supplyAsync(() -> run(script, profile, sessionId, listener, handle::started), workers)
                .whenComplete((report, failure) -> {
                    if (failure != null) {
                        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                                ? failure.getCause() : failure;
                        handle.completion.completeExceptionally(cause);
                    } else {
                        handle.completion.complete(report);
                    }
                });
        return handle;
    }

    /**
     * Applies edited rows as one unit on the session connection: either every statement takes
     * effect or, on the first failure, none does. When the session is already inside a
     * transaction (an earlier {@code BEGIN}), the change set runs under a savepoint of that
     * transaction and nothing is committed here; a failure rolls back to the savepoint only.
     */
    public ScriptReport applyChanges(List<String> statements, ConnectionProfile profile, String sessionId) {
        Objects.requireNonNull(statements, "statements");
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(sessionId, "sessionId");
        Instant started = Instant.now();
        if (statements.isEmpty()) {
            return new ScriptReport(profile.key(), sessionId, null, 0, List.of(), null, Duration.ZERO);
        }

        SessionLease session = connections.acquireSession(profile, sessionId);
        session.executionLock().lock();
        try {
            Connection conn = session.connection();
            List<ExecutionResult> results = new ArrayList<>();
            int index = 0;
            Instant t0 = Instant.now();
            boolean ownTransaction = false;
            boolean savepoint = false;
            try {
                if (ServerTransactions.isOpen(conn)) {
                    runSql(conn, "SAVEPOINT " + CHANGES_SAVEPOINT);
                    savepoint = true;
                } else {
                    conn.setAutoCommit(false);
                    ownTransaction = true;
                }
                try (Statement st = conn.createStatement()) {
                    for (; index < statements.size(); index++) {
                        String sql = statements.get(index);
                        t0 = Instant.now();
                        st.execute(sql);
                        results.add(new ExecutionResult(index, sql, List.of(), Map.of(), List.of(),
                                st.getUpdateCount(), CommandTags.of(sql), List.of(), since(t0),
                                session.backendPid(), null, false, false));
                    }
                }
                if (ownTransaction) {
                    conn.commit();
                } else {
                    runSql(conn, "RELEASE SAVEPOINT " + CHANGES_SAVEPOINT);
                }
                log.info("Applied {} change(s) on {}{}", results.size(), session,
                        ownTransaction ? "" : " inside the open transaction");
                return new ScriptReport(profile.key(), sessionId, session.backendPid(), statements.size(),
                        results, null, since(started));
            } catch (SQLException e) {
                String sql = index < statements.size() ? statements.get(index) : "";
                ExecutionError error = new ExecutionError(index, sql, message(e), e.getSQLState(), since(t0));
                if (ownTransaction) {
                    rollbackQuietly(conn, e);
                } else if (savepoint) {
                    rollbackToSavepoint(conn, e);
                }
                handleFailure(session, e);
                return new ScriptReport(profile.key(), sessionId, session.backendPid(), statements.size(),
                        List.of(), error, since(started));
            } finally {
                if (ownTransaction) {
                    restoreAutoCommit(conn);
                }
            }
        } finally {
            session.executionLock().unlock();
        }
    }

    private ScriptReport run(String script,
                             ConnectionProfile profile,
                             String sessionId,
                             ScriptListener listener,
                             Consumer<Integer> onBackendPid) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(sessionId, "sessionId");
        ScriptListener l = listener == null ? ScriptListener.NONE : listener;
        ConnectionKey key = profile.key();
        Instant started = Instant.now();

        List<String> statements = StatementSplitter.split(script);
        if (statements.isEmpty()) {
            l.onStarted(0, null);
            return new ScriptReport(key, sessionId, null, 0, List.of(), null, Duration.ZERO);
        }

        SessionLease session = connections.acquireSession(profile, sessionId);
        session.executionLock().lock();
        try {
            Integer pid = backendPid(session);
            onBackendPid.accept(pid);
            l.onStarted(statements.size(), pid);
            log.debug("Executing {} statement(s) on {} (pid {})", statements.size(), session, pid);

            List<ExecutionResult> results = new ArrayList<>();
            ExecutionError error = null;
            try (NoticeCapture notices = NoticeCapture.open(session.connection())) {
                for (int i = 0; i < statements.size(); i++) {
                    String sql = statements.get(i);
                    Instant t0 = Instant.now();
                    try {
                        ExecutionResult result = executeStatement(session, notices, i, sql, pid, l);
                        results.add(result);
                        recordHistory(profile, sql, true, result.elapsed(), result.rowCount(), null);
                        l.onResult(result);
                    } catch (SQLException e) {
                        error = new ExecutionError(i, sql, message(e), e.getSQLState(), since(t0));
                        recordHistory(profile, sql, false, error.elapsed(), null, error.message());
                        handleFailure(session, e);
                        l.onError(error);
                        break;
                    }
                }
            }
            return new ScriptReport(key, sessionId, pid, statements.size(), results, error, since(started));
        } finally {
            session.executionLock().unlock();
        }
    }

    private ExecutionResult executeStatement(SessionLease session,
                                             NoticeCapture notices,
                                             int index,
                                             String sql,
                                             Integer pid,
                                             ScriptListener listener) throws SQLException {
        if (props.streaming().enabled() && streamingPolicy.shouldStream(sql)) {
            return stream(session, notices, index, sql, pid, listener);
        }

        Connection conn = session.connection();
        int maxRows = props.execution().maxRows();
        Instant t0 = Instant.now();
        try (Statement st = conn.createStatement()) {
            // one extra row tells us whether the result was cut
            st.setMaxRows(maxRows == Integer.MAX_VALUE ? 0 : maxRows + 1);

            if (!st.execute(sql)) {
                long updateCount = st.getUpdateCount();
                Duration elapsed = since(t0);
                return new ExecutionResult(index, sql, List.of(), Map.of(), List.of(), updateCount,
                        CommandTags.of(sql), notices.drain(st), elapsed, pid, null, false, false);
            }

            List<String> columns;
            Map<String, String> columnTypes;
            List<List<Object>> rows = new ArrayList<>();
            boolean truncated;
            try (ResultSet rs = st.getResultSet()) {
                ResultSetMetaData md = rs.getMetaData();
                int n = md.getColumnCount();
                columns = new ArrayList<>(n);
                columnTypes = new LinkedHashMap<>();
                for (int c = 1; c <= n; c++) {
                    String label = md.getColumnLabel(c);
                    columns.add(label);
                    columnTypes.put(label, ColumnTypes.name(md.getColumnType(c), md.getColumnTypeName(c)));
                }
                while (rows.size() < maxRows && rs.next()) {
                    List<Object> row = new ArrayList<>(n);
                    for (int c = 1; c <= n; c++) {
                        row.add(rs.getObject(c));
                    }
                    rows.add(Collections.unmodifiableList(row));
                }
                truncated = rows.size() >= maxRows && rs.next();
            }
            Duration elapsed = since(t0);

            List<String> stmtNotices = notices.drain(st);
            if (truncated) {
                stmtNotices.add(ExecutionResult.truncationNotice(maxRows));
            }
            TableInfo info = tableInfo.resolve(conn, sql).orElse(null);
            return new ExecutionResult(index, sql, columns, Collections.unmodifiableMap(columnTypes),
                    Collections.unmodifiableList(rows), rows.size(), CommandTags.of(sql), stmtNotices,
                    elapsed, pid, info, false, truncated);
        }
    }

    private ExecutionResult stream(SessionLease session,
                                   NoticeCapture notices,
                                   int index,
                                   String sql,
                                   Integer pid,
                                   ScriptListener listener) throws SQLException {
        Connection conn = session.connection();
        Instant t0 = Instant.now();
        try (CursorStream cursor = cursorReader.stream(conn, sql, props.streaming().batchSize(),
                ServerTransactions.isOpen(conn))) {
            while (cursor.hasNext()) {
                listener.onBatch(index, cursor.next());
            }
            // exhausted, so the cursor statement is closed and its warnings are kept
            List<String> stmtNotices = notices.drainWith(cursor.warnings());
            List<String> columns = new ArrayList<>();
            Map<String, String> columnTypes = new LinkedHashMap<>();
            for (FieldInfo f : cursor.fields()) {
                columns.add(f.name());
                columnTypes.put(f.name(), ColumnTypes.name(f.jdbcType(), f.typeName()));
            }
            Duration elapsed = since(t0);
            log.debug("Streamed {} row(s) for statement {} on {}", cursor.totalRows(), index, session);
            TableInfo info = tableInfo.resolve(conn, sql).orElse(null);
            return new ExecutionResult(index, sql, columns, Collections.unmodifiableMap(columnTypes), List.of(),
                    cursor.totalRows(), CommandTags.of(sql), stmtNotices, elapsed, pid, info, true, false);
        } catch (CursorException e) {
            throw e.getCause();
        }
    }

    private Integer backendPid(SessionLease session) {
        Integer cached = session.backendPid();
        if (cached != null) return cached;
        try (Statement st = session.connection().createStatement();
             ResultSet rs = st.executeQuery("SELECT pg_backend_pid()")) {
            if (rs.next()) {
                int pid = rs.getInt(1);
                session.backendPid(pid);
                return pid;
            }
        } catch (SQLException e) {
            log.warn("Failed to get backend PID for {}; cancellation is unavailable: {}", session, e.getMessage());
        }
        return null;
    }

    private void handleFailure(SessionLease session, SQLException e) {
        if (ConnectionFailures.isConnectionFailure(e)) {
            log.warn("Connection of {} failed ({}); evicting session", session, e.getSQLState());
            connections.evictSession(session);
        }
    }

    private void recordHistory(ConnectionProfile profile, String sql, boolean success, Duration elapsed,
                               Long rowCount, String errorMessage) {
        try {
            history.record(new HistoryEntry(null, null, sql, success, elapsed, rowCount,
                    profile.displayName(), errorMessage));
        } catch (RuntimeException e) {
            log.warn("Failed to record query history: {}", e.getMessage());
        }
    }

    private static void rollbackQuietly(Connection conn, SQLException failure) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
            log.warn("Rollback after failed change set failed: {}", e.getMessage());
        }
    }

    private static void rollbackToSavepoint(Connection conn, SQLException failure) {
        try {
            runSql(conn, "ROLLBACK TO SAVEPOINT " + CHANGES_SAVEPOINT);
            runSql(conn, "RELEASE SAVEPOINT " + CHANGES_SAVEPOINT);
        } catch (SQLException e) {
            failure.addSuppressed(e);
            log.warn("Rollback to savepoint after failed change set failed: {}", e.getMessage());
        }
    }

    private static void runSql(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }

    private static void restoreAutoCommit(Connection conn) {
        try {
            if (!conn.isClosed()) {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.warn("Failed to restore autocommit: {}", e.getMessage());
        }
    }

    private static String message(SQLException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static Duration since(Instant start) {
        return Duration.between(start, Instant.now());
    }

    private static final class BackgroundScript implements ScriptExecutionHandle {
        private final ConnectionProfile profile;
        private final CancellationController cancellation;
        private final CompletableFuture<ScriptReport> completion = new CompletableFuture<>();
        private volatile Integer pid;

        BackgroundScript(ConnectionProfile profile, CancellationController cancellation) {
            this.profile = profile;
            this.cancellation = cancellation;
        }

        void started(Integer backendPid) {
            this.pid = backendPid;
        }

        @Override
        public Optional<Integer> backendPid() {
            return Optional.ofNullable(pid);
        }

        @Override
        public Optional<CancellationResult> cancel() {
            Integer p = pid;
            if (p == null || completion.isDone()) return Optional.empty();
            return Optional.of(cancellation.requestCancel(p, profile, profile.database()));
        }

        @Override
        public Optional<CancellationResult> terminate() {
            Integer p = pid;
            if (p == null || completion.isDone()) return Optional.empty();
            return Optional.of(cancellation.requestTerminate(p, profile, profile.database()));
        }

        @Override
        public CompletableFuture<ScriptReport> completion() {
            return completion;
        }
    }
}
