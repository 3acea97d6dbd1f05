package org.pgstudio.cursor;

import java.util.List;

/**
 * One batch of rows pulled from a server-side cursor.
 *
 * @param rows           rows in column order
 * @param fields         column metadata, identical for every batch of a stream
 * @param batchNumber    1-based
 * @param firstBatch     true only for batch 1
 * @param complete       true when the cursor returned fewer rows than the batch size
 * @param totalRowsSoFar cumulative row count including this batch
 */
public record StreamBatch(
        List<List<Object>> rows,
        List<FieldInfo> fields,
        int batchNumber,
        boolean firstBatch,
        boolean complete,
        long totalRowsSoFar
) {
    public StreamBatch {
        rows = List.copyOf(rows);
        fields = List.copyOf(fields);
    }

    public int size() {
        return rows.size();
    }
}
