package org.pgstudio.kernel.api;

import org.pgstudio.cursor.StreamBatch;
import org.pgstudio.kernel.executor.ExecutionResult;
import org.pgstudio.kernel.executor.ScriptListener;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the batches of streamed statements so a synchronous response can return their rows,
 * at most {@code maxRows} per statement.
 */
final class StreamedRowCollector implements ScriptListener {

    private final int maxRows;
    private final Map<Integer, List<List<Object>>> rows = new HashMap<>();
    private final Set<Integer> cut = new HashSet<>();

    StreamedRowCollector(int maxRows) {
        this.maxRows = maxRows;
    }

    @Override
    public void onBatch(int statementIndex, StreamBatch batch) {
        List<List<Object>> kept = rows.computeIfAbsent(statementIndex, i -> new ArrayList<>());
        int room = maxRows - kept.size();
        if (batch.size() > room) {
            cut.add(statementIndex);
            if (room > 0) {
                kept.addAll(batch.rows().subList(0, room));
            }
        } else {
            kept.addAll(batch.rows());
        }
    }

    List<ExecutionResult> merge(List<ExecutionResult> results) {
        List<ExecutionResult> out = new ArrayList<>(results.size());
        for (ExecutionResult r : results) {
            if (r.streamed()) {
                int i = r.statementIndex();
                out.add(r.withRows(rows.getOrDefault(i, List.of()), cut.contains(i)));
            } else {
                out.add(r);
            }
        }
        return out;
    }
}
