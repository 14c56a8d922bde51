package org.changeflow.adapters;

import java.util.List;
import java.util.Map;

/**
 * Storage primitives for canonical and staging row tables. Row reads and writes join the caller's
 * transaction. {@link #createTableIfMissing} and {@link #dropTable} are DDL and end the running transaction
 * on databases without transactional DDL, so callers issue them before taking locks or after their last
 * row write.
 */
public interface RowStore {

    boolean tableExists(TableRef table);

    void createTableIfMissing(TableRef table);

    int appendRows(TableRef table, List<Map<String, Object>> rows);

    /**
     * Copies every row of {@code source} into {@code target} with a single statement, keeping row order.
     *
     * @return number of rows copied
     */
    long appendFrom(TableRef source, TableRef target);

    /**
     * Deletes every row of {@code table} without dropping it.
     *
     * @return number of rows deleted
     */
    long clearRows(TableRef table);

    long countRows(TableRef table);

    List<Map<String, Object>> sampleRows(TableRef table, int limit);

    List<Map<String, Object>> readRows(TableRef table);

    void dropTable(TableRef table);
}
