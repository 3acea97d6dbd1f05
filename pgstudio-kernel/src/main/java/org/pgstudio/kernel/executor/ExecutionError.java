package org.pgstudio.kernel.executor;

import java.time.Duration;

/** The statement that stopped a script. */
public record ExecutionError(
        int statementIndex,
        String statement,
        String message,
        String sqlState,
        Duration elapsed
) implements StatementOutcome {

    @Override
    public boolean success() {
        return false;
    }
}
