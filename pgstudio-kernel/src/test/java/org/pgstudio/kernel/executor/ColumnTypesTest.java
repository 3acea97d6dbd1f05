package org.pgstudio.kernel.executor;

import org.junit.jupiter.api.Test;

import java.sql.Types;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ColumnTypesTest {

    @Test
    void driverPostgresNamesWin() {
        assertEquals("text", ColumnTypes.name(Types.VARCHAR, "text"));
        assertEquals("timestamptz", ColumnTypes.name(Types.TIMESTAMP, "timestamptz"));
        assertEquals("json", ColumnTypes.name(Types.OTHER, "json"));
    }

    @Test
    void jdbcCodesMapWhenTheNameIsForeign() {
        assertEquals("int4", ColumnTypes.name(Types.INTEGER, "INTEGER"));
        assertEquals("int8", ColumnTypes.name(Types.BIGINT, "BIGINT"));
        assertEquals("bool", ColumnTypes.name(Types.BOOLEAN, "BOOLEAN"));
        assertEquals("numeric", ColumnTypes.name(Types.DECIMAL, null));
        assertEquals("varchar", ColumnTypes.name(Types.VARCHAR, "CHARACTER VARYING"));
    }

    @Test
    void unknownTypesFallBackToString() {
        assertEquals("string", ColumnTypes.name(Types.OTHER, "hstore"));
        assertEquals("string", ColumnTypes.name(Types.ARRAY, "_int4"));
    }
}
