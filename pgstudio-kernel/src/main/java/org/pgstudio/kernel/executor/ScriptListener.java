package org.pgstudio.kernel.executor;

import org.pgstudio.cursor.StreamBatch;

/**
 * Incremental script progress. Callbacks run on the executing thread, in statement order.
 */
public interface ScriptListener {

    ScriptListener NONE = new ScriptListener() {
    };

    /** The script was split and a session acquired. {@code backendPid} may be null. */
    default void onStarted(int statementCount, Integer backendPid) {
    }

    default void onResult(ExecutionResult result) {
    }

    /** Called at most once; no further statements run afterwards. */
    default void onError(ExecutionError error) {
    }

    default void onBatch(int statementIndex, StreamBatch batch) {
    }
}
