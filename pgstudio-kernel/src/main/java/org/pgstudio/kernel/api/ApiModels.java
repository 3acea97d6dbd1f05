package org.pgstudio.kernel.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.pgstudio.kernel.executor.ExecutionError;
import org.pgstudio.kernel.executor.ExecutionResult;
import org.pgstudio.kernel.executor.ScriptReport;

import java.util.List;

public final class ApiModels {

    public static final String DEFAULT_SESSION = "default";

    private ApiModels() {}

    /** {@code database} and {@code sessionId} are optional; they default to the profile database and "default". */
    public record ExecuteScriptRequest(
            String connectionId,
            String database,
            String sessionId,
            String sql
    ) {}

    public record ApplyChangesRequest(
            String connectionId,
            String database,
            String sessionId,
            List<String> statements
    ) {}

    public record CancelRequest(
            String connectionId,
            String database,
            Integer backendPid,
            boolean terminate
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ScriptResponse(
            String connection,
            String sessionId,
            Integer backendPid,
            int statementCount,
            boolean success,
            List<ExecutionResult> results,
            ExecutionError error,
            long elapsedMs
    ) {
        static ScriptResponse of(ScriptReport r) {
            return of(r, r.results());
        }

        static ScriptResponse of(ScriptReport r, List<ExecutionResult> results) {
            return new ScriptResponse(r.key().toString(), r.sessionId(), r.backendPid(), r.statementCount(),
                    r.success(), results, r.error(), r.elapsed().toMillis());
        }
    }

    public record ErrorResponse(String error, String message) {}
}
