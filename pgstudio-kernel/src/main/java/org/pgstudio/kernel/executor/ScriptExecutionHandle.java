package org.pgstudio.kernel.executor;

import org.pgstudio.kernel.cancel.CancellationResult;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/** A script running in the background. */
public interface ScriptExecutionHandle {

    /** Known once the session is acquired and the pid lookup succeeded. */
    Optional<Integer> backendPid();

    /** Cancels the running statement. Empty if there is no pid to signal yet. */
    Optional<CancellationResult> cancel();

    /** Terminates the backend. Empty if there is no pid to signal yet. */
    Optional<CancellationResult> terminate();

    CompletableFuture<ScriptReport> completion();
}
