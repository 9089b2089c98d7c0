package com.livemux.store;

import com.livemux.schema.Table;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of one table's rows for one peer, as fetched by a single refresh cycle.
 * Readers holding a snapshot are never affected by later refreshes.
 */
public final class TableSnapshot {

    private final Table table;
    private final List<Row> rows;
    private final Map<String, Row> rowsByKey;
    private final long refreshedAt;

    public TableSnapshot(Table table, List<Row> rows, long refreshedAt) {
        this.table = table;
        this.rows = Collections.unmodifiableList(rows);
        this.refreshedAt = refreshedAt;
        if (table.getKeyColumns().isEmpty()) {
            this.rowsByKey = Collections.emptyMap();
        } else {
            Map<String, Row> index = new HashMap<>(rows.size() * 2);
            for (Row row : rows) {
                index.putIfAbsent(table.keyOf(row), row);
            }
            this.rowsByKey = Collections.unmodifiableMap(index);
        }
    }

    public static TableSnapshot empty(Table table) {
        return new TableSnapshot(table, Collections.emptyList(), 0L);
    }

    public Table getTable() {
        return table;
    }

    public List<Row> getRows() {
        return rows;
    }

    /**
     * Look up a row by its key, e.g. a host name or {@code host;service}.
     */
    public Row findByKey(String key) {
        return rowsByKey.get(key);
    }

    /**
     * Epoch seconds of the refresh that produced this snapshot, 0 if never refreshed.
     */
    public long getRefreshedAt() {
        return refreshedAt;
    }

    public int size() {
        return rows.size();
    }
}
