package org.pgstudio.kernel.history;

import java.time.Duration;
import java.time.Instant;

/**
 * One executed statement as shown in the query history.
 *
 * @param rowCount     null for failed statements and commands without a row count
 * @param errorMessage null on success
 */
public record HistoryEntry(
        String id,
        Instant timestamp,
        String query,
        boolean success,
        Duration duration,
        Long rowCount,
        String connectionName,
        String errorMessage
) {
}
