package org.pgstudio.kernel.executor;

import java.time.Duration;

/** Per-statement outcome of a script: either an {@link ExecutionResult} or an {@link ExecutionError}. */
public interface StatementOutcome {

    /** 0-based position of the statement in its script. */
    int statementIndex();

    String statement();

    Duration elapsed();

    boolean success();
}
