package org.pgstudio.kernel.executor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A successfully executed statement.
 *
 * @param columns     column labels in result order; empty for commands without a result set
 * @param columnTypes column label -> PostgreSQL type name
 * @param rows        materialized rows; empty when {@code streamed}
 * @param rowCount    rows returned, or rows affected for DML; -1 when the server reports none
 * @param command     command tag, e.g. {@code SELECT}, {@code INSERT}, {@code CREATE}
 * @param backendPid  pid of the session backend, null if it could not be determined
 * @param tableInfo   source table hint for SELECTs, null when unknown
 * @param streamed    rows went to {@link ScriptListener#onBatch} instead of {@code rows}
 * @param truncated   more rows existed than were materialized
 */
public record ExecutionResult(
        int statementIndex,
        String statement,
        List<String> columns,
        Map<String, String> columnTypes,
        List<List<Object>> rows,
        long rowCount,
        String command,
        List<String> notices,
        Duration elapsed,
        Integer backendPid,
        TableInfo tableInfo,
        boolean streamed,
        boolean truncated
) implements StatementOutcome {

    public ExecutionResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        columnTypes = columnTypes == null ? Map.of() : columnTypes;
        rows = rows == null ? List.of() : rows;
        notices = notices == null ? List.of() : List.copyOf(notices);
    }

    /**
     * This result carrying {@code collected} as its inline rows, for callers that gathered the
     * batches of a streamed statement themselves. {@code rowCount} keeps the streamed total.
     */
    public ExecutionResult withRows(List<List<Object>> collected, boolean cut) {
        List<String> n = notices;
        if (cut) {
            n = new ArrayList<>(notices);
            n.add(truncationNotice(collected.size()));
        }
        return new ExecutionResult(statementIndex, statement, columns, columnTypes, List.copyOf(collected),
                rowCount, command, n, elapsed, backendPid, tableInfo, streamed, truncated || cut);
    }

    static String truncationNotice(int maxRows) {
        return "Result truncated to the first " + maxRows + " rows";
    }

    @Override
    public boolean success() {
        return true;
    }
}
