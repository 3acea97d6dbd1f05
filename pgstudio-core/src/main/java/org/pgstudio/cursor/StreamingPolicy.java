package org.pgstudio.cursor;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a statement is worth streaming through a cursor.
 *
 * <p>Only plain SELECTs qualify. Aggregations usually return few rows, and an explicit small
 * {@code LIMIT} already bounds the result, so both fall back to immediate execution.
 */
public final class StreamingPolicy {

    public static final int DEFAULT_BATCH_SIZE = 200;
    public static final int DEFAULT_LIMIT_THRESHOLD = 1000;

    private static final List<String> AGGREGATION_KEYWORDS =
            List.of("count(", "sum(", "avg(", "min(", "max(", "group by");

    private static final Pattern LIMIT = Pattern.compile("limit\\s+(\\d+)");

    private final int limitThreshold;

    public StreamingPolicy() {
        this(DEFAULT_LIMIT_THRESHOLD);
    }

    public StreamingPolicy(int limitThreshold) {
        this.limitThreshold = limitThreshold <= 0 ? DEFAULT_LIMIT_THRESHOLD : limitThreshold;
    }

    public int limitThreshold() {
        return limitThreshold;
    }

    public boolean shouldStream(String query) {
        if (query == null) return false;
        String normalized = query.trim().toLowerCase(Locale.ROOT);
        return isStreamable(normalized) && !hasSmallLimit(normalized);
    }

    private static boolean isStreamable(String normalized) {
        if (!normalized.startsWith("select")) return false;
        for (String keyword : AGGREGATION_KEYWORDS) {
            if (normalized.contains(keyword)) return false;
        }
        return true;
    }

    private boolean hasSmallLimit(String normalized) {
        Matcher m = LIMIT.matcher(normalized);
        if (!m.find()) return false;
        try {
            return Long.parseLong(m.group(1)) <= limitThreshold;
        } catch (NumberFormatException e) {
            // more digits than a long holds: certainly above the threshold
            return false;
        }
    }
}
