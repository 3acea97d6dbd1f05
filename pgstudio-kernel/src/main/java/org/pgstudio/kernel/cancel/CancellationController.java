package org.pgstudio.kernel.cancel;

import org.pgstudio.kernel.KernelException;
import org.pgstudio.kernel.connection.ConnectionMultiplexer;
import org.pgstudio.kernel.connection.ConnectionProfile;
import org.pgstudio.kernel.connection.PooledLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Objects;

/**
 * Signals a running statement from the outside.
 *
 * <p>The signal travels over a short-lived pooled connection for the same profile and database,
 * never over the session connection that is busy executing. Nothing is thrown: every failure
 * comes back as an unsuccessful {@link CancellationResult}.
 */
public class CancellationController {
    private static final Logger log = LoggerFactory.getLogger(CancellationController.class);

    private final ConnectionMultiplexer connections;

    public CancellationController(ConnectionMultiplexer connections) {
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    public CancellationResult requestCancel(int backendPid, ConnectionProfile profile, String database) {
        return request(backendPid, profile, database, CancelMode.CANCEL);
    }

    public CancellationResult requestTerminate(int backendPid, ConnectionProfile profile, String database) {
        return request(backendPid, profile, database, CancelMode.TERMINATE);
    }

    public CancellationResult request(int backendPid, ConnectionProfile profile, String database, CancelMode mode) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(mode, "mode");
        ConnectionProfile target = profile.withDatabase(database);
        CancellationRequest request = new CancellationRequest(backendPid, target.key(), mode);

        if (backendPid <= 0) {
            return CancellationResult.failed(request, "No backend pid to signal");
        }

        try (PooledLease lease = connections.acquirePooled(target);
             PreparedStatement ps = lease.connection().prepareStatement(mode.sql())) {
            ps.setInt(1, backendPid);
            boolean signalled = false;
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    signalled = rs.getBoolean(1);
                }
            }
            if (!signalled) {
                log.info("{} of backend {} on {} was not accepted", mode, backendPid, target.key());
                return CancellationResult.failed(request,
                        "Server did not signal backend " + backendPid + " (already finished or not permitted)");
            }
            log.info("{} sent to backend {} on {}", mode, backendPid, target.key());
            return CancellationResult.ok(request);
        } catch (SQLException | KernelException e) {
            String verb = mode.name().toLowerCase(Locale.ROOT);
            log.warn("Failed to {} backend {} on {}: {}", verb, backendPid, target.key(), e.getMessage());
            return CancellationResult.failed(request, "Failed to " + verb + " query: " + e.getMessage());
        }
    }
}
