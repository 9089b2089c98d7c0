package com.livemux.store;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Per-query, per-peer view of the mirrored data.
 *
 * Every table touched while evaluating one query is captured at most once, so
 * reference columns and group-by tables see a self-consistent set of snapshots even if
 * a refresh publishes new data mid-query. Not shared between threads.
 */
public class QueryScope {

    private final String peerKey;
    private final String peerName;
    private final Function<String, TableSnapshot> snapshotSource;
    private final Map<String, TableSnapshot> captured = new HashMap<>();

    public QueryScope(String peerKey, String peerName, Function<String, TableSnapshot> snapshotSource) {
        this.peerKey = peerKey;
        this.peerName = peerName;
        this.snapshotSource = snapshotSource;
    }

    public String getPeerKey() {
        return peerKey;
    }

    public String getPeerName() {
        return peerName;
    }

    /**
     * Snapshot of the named table, captured on first access.
     */
    public TableSnapshot snapshot(String tableName) {
        return captured.computeIfAbsent(tableName, snapshotSource);
    }

    /**
     * Row of another table addressed by key, or null if it is not mirrored or unknown.
     */
    public Row lookup(String tableName, String key) {
        TableSnapshot snapshot = snapshot(tableName);
        return snapshot == null ? null : snapshot.findByKey(key);
    }
}
