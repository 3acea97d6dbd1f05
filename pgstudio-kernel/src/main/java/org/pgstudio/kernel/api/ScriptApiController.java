package org.pgstudio.kernel.api;

import org.pgstudio.kernel.cancel.CancelMode;
import org.pgstudio.kernel.cancel.CancellationController;
import org.pgstudio.kernel.cancel.CancellationResult;
import org.pgstudio.kernel.config.KernelProperties;
import org.pgstudio.kernel.connection.ConnectionMultiplexer;
import org.pgstudio.kernel.connection.ConnectionProfile;
import org.pgstudio.kernel.connection.ConnectionProfileRegistry;
import org.pgstudio.kernel.executor.ScriptExecutor;
import org.pgstudio.kernel.executor.ScriptReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

/**
 * Script execution over HTTP. Results are returned once the whole script finished, streamed
 * statements included (up to the inline row limit); long-running statements can be cancelled from
 * another request with the backend pid from an earlier response.
 */
@RestController
@RequestMapping("/api/v1")
public class ScriptApiController {

    private final ConnectionProfileRegistry profiles;
    private final ScriptExecutor executor;
    private final CancellationController cancellation;
    private final ConnectionMultiplexer connections;
    private final KernelProperties props;

    public ScriptApiController(ConnectionProfileRegistry profiles,
                               ScriptExecutor executor,
                               CancellationController cancellation,
                               ConnectionMultiplexer connections,
                               KernelProperties props) {
        this.profiles = Objects.requireNonNull(profiles);
        this.executor = Objects.requireNonNull(executor);
        this.cancellation = Objects.requireNonNull(cancellation);
        this.connections = Objects.requireNonNull(connections);
        this.props = props == null ? KernelProperties.defaults() : props;
    }

    @PostMapping("/scripts")
    public ApiModels.ScriptResponse execute(@RequestBody ApiModels.ExecuteScriptRequest req) {
        if (req == null || req.sql() == null) {
            throw new IllegalArgumentException("sql is required");
        }
        ConnectionProfile profile = profile(req.connectionId(), req.database());
        StreamedRowCollector streamed = new StreamedRowCollector(props.execution().maxRows());
        ScriptReport report = executor.execute(req.sql(), profile, sessionId(req.sessionId()), streamed);
        return ApiModels.ScriptResponse.of(report, streamed.merge(report.results()));
    }

    @PostMapping("/scripts/changes")
    public ApiModels.ScriptResponse applyChanges(@RequestBody ApiModels.ApplyChangesRequest req) {
        if (req == null || req.statements() == null) {
            throw new IllegalArgumentException("statements are required");
        }
        ConnectionProfile profile = profile(req.connectionId(), req.database());
        return ApiModels.ScriptResponse.of(
                executor.applyChanges(req.statements(), profile, sessionId(req.sessionId())));
    }

    @PostMapping("/cancellations")
    public CancellationResult cancel(@RequestBody ApiModels.CancelRequest req) {
        if (req == null || req.backendPid() == null) {
            throw new IllegalArgumentException("backendPid is required");
        }
        ConnectionProfile profile = profiles.require(requireId(req.connectionId()));
        CancelMode mode = req.terminate() ? CancelMode.TERMINATE : CancelMode.CANCEL;
        return cancellation.request(req.backendPid(), profile, req.database(), mode);
    }

    @DeleteMapping("/sessions/{connectionId}/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String connectionId,
                                             @PathVariable String sessionId,
                                             @RequestParam(value = "database", required = false) String database) {
        boolean closed = connections.closeSession(profile(connectionId, database), sessionId);
        return closed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @DeleteMapping("/connections/{connectionId}")
    public ResponseEntity<Void> closeConnection(@PathVariable String connectionId) {
        profiles.require(connectionId);
        connections.closeAllForProfileId(connectionId);
        return ResponseEntity.noContent().build();
    }

    private ConnectionProfile profile(String connectionId, String database) {
        return profiles.require(requireId(connectionId)).withDatabase(database);
    }

    private static String requireId(String connectionId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId is required");
        }
        return connectionId;
    }

    private static String sessionId(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? ApiModels.DEFAULT_SESSION : sessionId;
    }
}
