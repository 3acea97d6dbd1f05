package org.pgstudio.kernel.executor;

import java.util.List;

/** The table a result most likely came from, with its primary key columns, for row write-back. */
public record TableInfo(String schema, String table, List<String> primaryKeys) {

    public TableInfo {
        primaryKeys = primaryKeys == null ? List.of() : List.copyOf(primaryKeys);
    }
}
