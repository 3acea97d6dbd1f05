package org.pgstudio.kernel.config;

import org.pgstudio.cursor.StreamingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning for the script kernel.
 *
 * <p>Every group is optional; missing values fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "pgstudio.kernel")
public record KernelProperties(
        Pool pool,
        Session session,
        Streaming streaming,
        Execution execution,
        History history,
        Ssh ssh
) {
    public KernelProperties {
        pool = pool == null ? new Pool(0, null, null) : pool;
        session = session == null ? new Session(null) : session;
        streaming = streaming == null ? new Streaming(false, 0, 0) : streaming;
        execution = execution == null ? new Execution(0, 0) : execution;
        history = history == null ? new History(0, 0) : history;
        ssh = ssh == null ? new Ssh(null) : ssh;
    }

    public static KernelProperties defaults() {
        return new KernelProperties(null, null, null, null, null, null);
    }

    /** Ephemeral (pooled) leases, one pool per connection key. */
    public record Pool(
            int maxSize,
            Duration idleTimeout,
            Duration connectionTimeout
    ) {
        public Pool {
            maxSize = maxSize <= 0 ? 10 : maxSize;
            idleTimeout = positiveOr(idleTimeout, Duration.ofSeconds(30));
            connectionTimeout = positiveOr(connectionTimeout, Duration.ofSeconds(10));
        }
    }

    /** Long-lived session leases. */
    public record Session(Duration validationTimeout) {
        public Session {
            validationTimeout = positiveOr(validationTimeout, Duration.ofSeconds(2));
        }
    }

    /**
     * Cursor streaming for large SELECTs. Off by default: results are then materialized inline
     * (bounded by {@link Execution#maxRows()}).
     */
    public record Streaming(
            boolean enabled,
            int batchSize,
            int limitThreshold
    ) {
        public Streaming {
            batchSize = batchSize <= 0 ? StreamingPolicy.DEFAULT_BATCH_SIZE : batchSize;
            limitThreshold = limitThreshold <= 0 ? StreamingPolicy.DEFAULT_LIMIT_THRESHOLD : limitThreshold;
        }
    }

    public record Execution(
            int maxRows,
            int workerThreads
    ) {
        public Execution {
            maxRows = maxRows <= 0 ? 10_000 : maxRows;
            // 0 means an unbounded cached pool
            workerThreads = Math.max(0, workerThreads);
        }
    }

    public record History(
            int maxEntries,
            int maxQueryLength
    ) {
        public History {
            maxEntries = maxEntries <= 0 ? 100 : maxEntries;
            maxQueryLength = maxQueryLength <= 0 ? 1000 : maxQueryLength;
        }
    }

    /** Optional forced {@code SshTunnelProvider} id. */
    public record Ssh(String provider) {
    }

    private static Duration positiveOr(Duration d, Duration fallback) {
        return d == null || d.isNegative() || d.isZero() ? fallback : d;
    }
}
