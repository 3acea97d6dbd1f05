package org.pgstudio.cursor;

/** Column metadata carried with each streamed batch. */
public record FieldInfo(String name, int jdbcType, String typeName) {
}
