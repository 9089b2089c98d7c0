package com.livemux.store;

import com.livemux.schema.Table;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Mirror of one table for one peer.
 *
 * The refresh task is the only writer and publishes complete snapshots by reference;
 * any number of queries read concurrently without locking.
 */
public class TableStore {

    private final Table table;
    private final AtomicReference<TableSnapshot> current;

    public TableStore(Table table) {
        this.table = table;
        this.current = new AtomicReference<>(TableSnapshot.empty(table));
    }

    public Table getTable() {
        return table;
    }

    public TableSnapshot snapshot() {
        return current.get();
    }

    /**
     * Publish a new snapshot, replacing the previous one wholesale.
     */
    public void publish(TableSnapshot snapshot) {
        if (snapshot.getTable() != table) {
            throw new IllegalArgumentException("Snapshot of " + snapshot.getTable().getName()
                    + " cannot be published to store of " + table.getName());
        }
        current.set(snapshot);
    }
}
