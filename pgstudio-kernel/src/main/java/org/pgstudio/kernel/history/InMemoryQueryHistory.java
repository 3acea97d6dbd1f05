package org.pgstudio.kernel.history;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Bounded, newest-first query history kept in memory.
 *
 * <p>Once {@code maxEntries} is reached the oldest entry is dropped. Queries longer than
 * {@code maxQueryLength} are cut and suffixed with {@value #TRUNCATION_SUFFIX}.
 */
public class InMemoryQueryHistory implements QueryHistorySink {

    static final String TRUNCATION_SUFFIX = "... (truncated)";

    private final int maxEntries;
    private final int maxQueryLength;
    private final Clock clock;
    private final Deque<HistoryEntry> entries = new ArrayDeque<>();

    public InMemoryQueryHistory(int maxEntries, int maxQueryLength) {
        this(maxEntries, maxQueryLength, Clock.systemUTC());
    }

    InMemoryQueryHistory(int maxEntries, int maxQueryLength, Clock clock) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
        if (maxQueryLength <= 0) throw new IllegalArgumentException("maxQueryLength must be > 0");
        this.maxEntries = maxEntries;
        this.maxQueryLength = maxQueryLength;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized void record(HistoryEntry entry) {
        Objects.requireNonNull(entry, "entry");
        HistoryEntry stored = new HistoryEntry(
                entry.id() == null ? UUID.randomUUID().toString() : entry.id(),
                entry.timestamp() == null ? clock.instant() : entry.timestamp(),
                truncate(entry.query()),
                entry.success(),
                entry.duration(),
                entry.rowCount(),
                entry.connectionName(),
                entry.errorMessage());

        entries.addFirst(stored);
        while (entries.size() > maxEntries) {
            entries.removeLast();
        }
    }

    public synchronized List<HistoryEntry> recent() {
        return List.copyOf(entries);
    }

    public synchronized List<HistoryEntry> recent(int limit) {
        return entries.stream().limit(Math.max(0, limit)).toList();
    }

    public synchronized boolean delete(String id) {
        return entries.removeIf(e -> e.id().equals(id));
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    private String truncate(String query) {
        if (query == null || query.length() <= maxQueryLength) return query;
        return query.substring(0, maxQueryLength) + TRUNCATION_SUFFIX;
    }
}
