package org.pgstudio.kernel.executor;

import org.pgstudio.kernel.connection.ConnectionKey;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Summary of one script run.
 *
 * @param statementCount statements the script was split into; may exceed the number that ran
 * @param error          the failing statement, null if every statement succeeded
 */
public record ScriptReport(
        ConnectionKey key,
        String sessionId,
        Integer backendPid,
        int statementCount,
        List<ExecutionResult> results,
        ExecutionError error,
        Duration elapsed
) {
    public ScriptReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean success() {
        return error == null;
    }

    public Optional<ExecutionError> failure() {
        return Optional.ofNullable(error);
    }

    /** Results in order, followed by the error if there was one. */
    public List<StatementOutcome> outcomes() {
        List<StatementOutcome> out = new ArrayList<>(results);
        if (error != null) out.add(error);
        return out;
    }
}
