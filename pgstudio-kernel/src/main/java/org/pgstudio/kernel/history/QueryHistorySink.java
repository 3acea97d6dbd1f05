package org.pgstudio.kernel.history;

/** Receives every executed statement. Implementations must not throw back into execution. */
@FunctionalInterface
public interface QueryHistorySink {

    void record(HistoryEntry entry);
}
