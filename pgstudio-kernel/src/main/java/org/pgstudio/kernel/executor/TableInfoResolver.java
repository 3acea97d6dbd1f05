package org.pgstudio.kernel.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort guess of the table behind a result, so edited rows can be written back by primary
 * key.
 *
 * <p>Heuristic only: the first {@code FROM <name>} wins, joins and sub-selects are not understood,
 * and an unqualified name is assumed to live in {@code public}. Failures yield
 * {@link Optional#empty()}.
 */
final class TableInfoResolver {
    private static final Logger log = LoggerFactory.getLogger(TableInfoResolver.class);

    static final String DEFAULT_SCHEMA = "public";

    private static final Pattern FROM = Pattern.compile("(?i)FROM\\s+[\"']?([a-zA-Z0-9_.]+)[\"']?");

    Optional<TableInfo> resolve(Connection conn, String statement) {
        Optional<TableInfo> target = parse(statement);
        if (target.isEmpty()) return target;

        TableInfo t = target.get();
        try {
            List<String> pks = primaryKeys(conn.getMetaData(), t.schema(), t.table());
            if (pks.isEmpty()) return Optional.empty();
            return Optional.of(new TableInfo(t.schema(), t.table(), pks));
        } catch (SQLException | RuntimeException e) {
            log.debug("Primary key lookup for {}.{} failed: {}", t.schema(), t.table(), e.getMessage());
            return Optional.empty();
        }
    }

    /** Schema and table named after the first FROM, without primary keys. */
    static Optional<TableInfo> parse(String statement) {
        if (statement == null) return Optional.empty();
        Matcher m = FROM.matcher(statement);
        if (!m.find()) return Optional.empty();

        String[] parts = m.group(1).split("\\.");
        if (parts.length == 0 || parts[parts.length - 1].isEmpty()) return Optional.empty();
        String schema = parts.length > 1 ? parts[0] : DEFAULT_SCHEMA;
        String table = parts.length > 1 ? parts[1] : parts[0];
        return Optional.of(new TableInfo(schema, table, List.of()));
    }

    private static List<String> primaryKeys(DatabaseMetaData md, String schema, String table) throws SQLException {
        String s = normalize(md, schema);
        String t = normalize(md, table);
        TreeMap<Short, String> bySeq = new TreeMap<>();
        try (ResultSet rs = md.getPrimaryKeys(null, s, t)) {
            while (rs.next()) {
                bySeq.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        return new ArrayList<>(bySeq.values());
    }

    // unquoted identifiers are folded by the server; match its catalog
    private static String normalize(DatabaseMetaData md, String identifier) throws SQLException {
        if (md.storesUpperCaseIdentifiers()) return identifier.toUpperCase(Locale.ROOT);
        if (md.storesLowerCaseIdentifiers()) return identifier.toLowerCase(Locale.ROOT);
        return identifier;
    }
}
