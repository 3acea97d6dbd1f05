package org.pgstudio.kernel.executor;

import java.sql.Types;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Maps result column metadata to the PostgreSQL type names shown next to column headers. */
final class ColumnTypes {

    static final String FALLBACK = "string";

    private static final Set<String> PG_NAMES = Set.of(
            "bool", "bytea", "int8", "int2", "int4", "text", "json", "jsonb", "varchar",
            "date", "time", "timestamp", "timestamptz", "numeric", "float4", "float8", "uuid");

    private static final Map<Integer, String> BY_JDBC_TYPE = Map.ofEntries(
            Map.entry(Types.BOOLEAN, "bool"),
            Map.entry(Types.BIT, "bool"),
            Map.entry(Types.BINARY, "bytea"),
            Map.entry(Types.VARBINARY, "bytea"),
            Map.entry(Types.LONGVARBINARY, "bytea"),
            Map.entry(Types.BIGINT, "int8"),
            Map.entry(Types.SMALLINT, "int2"),
            Map.entry(Types.TINYINT, "int2"),
            Map.entry(Types.INTEGER, "int4"),
            Map.entry(Types.VARCHAR, "varchar"),
            Map.entry(Types.NVARCHAR, "varchar"),
            Map.entry(Types.LONGVARCHAR, "text"),
            Map.entry(Types.CLOB, "text"),
            Map.entry(Types.DATE, "date"),
            Map.entry(Types.TIME, "time"),
            Map.entry(Types.TIMESTAMP, "timestamp"),
            Map.entry(Types.TIMESTAMP_WITH_TIMEZONE, "timestamptz"),
            Map.entry(Types.NUMERIC, "numeric"),
            Map.entry(Types.DECIMAL, "numeric"),
            Map.entry(Types.REAL, "float4"),
            Map.entry(Types.FLOAT, "float8"),
            Map.entry(Types.DOUBLE, "float8")
    );

    private ColumnTypes() {
    }

    /**
     * The driver's own type name wins when it already is a PostgreSQL name (pgjdbc reports
     * {@code text} and {@code timestamptz} under generic JDBC codes); otherwise the JDBC code
     * decides, and anything unknown is {@value #FALLBACK}.
     */
    static String name(int jdbcType, String driverTypeName) {
        if (driverTypeName != null) {
            String n = driverTypeName.toLowerCase(Locale.ROOT);
            if (PG_NAMES.contains(n)) return n;
        }
        return BY_JDBC_TYPE.getOrDefault(jdbcType, FALLBACK);
    }
}
