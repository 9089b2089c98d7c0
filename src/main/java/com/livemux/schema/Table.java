package com.livemux.schema;

import com.livemux.store.Row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Static description of a Livestatus table.
 *
 * Mirrored tables are refreshed from every peer, virtual tables are computed from peer
 * state, group-by tables are synthesized from a backing table on every query and
 * passthrough tables are never mirrored.
 */
public class Table {

    private final String name;
    private final List<Column> columns;
    private final Map<String, Column> columnsByName;
    private final List<Column> storedColumns;
    private final List<String> keyColumns;
    private final List<Integer> keyIndexes;
    private final String prefix;
    private final boolean virtual;
    private final boolean passthroughOnly;
    private final Table backingTable;
    private final Column explodeColumn;

    private Table(Builder builder) {
        this.name = builder.name;
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns.values()));
        this.columnsByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.columns));
        this.storedColumns = columns.stream()
                .filter(Column::isStored)
                .collect(Collectors.toUnmodifiableList());
        this.keyColumns = List.copyOf(builder.keyColumns);
        this.keyIndexes = builder.keyColumns.stream()
                .map(key -> columnsByName.get(key).getIndex())
                .collect(Collectors.toUnmodifiableList());
        this.prefix = builder.prefix;
        this.virtual = builder.virtual;
        this.passthroughOnly = builder.passthroughOnly;
        this.backingTable = builder.backingTable;
        this.explodeColumn = builder.explodeColumn;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Start a group-by table that explodes {@code explodeColumn} of the backing table
     * into one row per element, appending the element as column {@code groupColumn}.
     */
    public static Builder groupBy(String name, Table backing, String explodeColumn, String groupColumn) {
        Builder builder = new Builder(name);
        builder.backingTable = backing;
        builder.explodeColumn = backing.getColumn(explodeColumn);
        builder.prefix = backing.prefix;
        builder.columns.putAll(backing.columnsByName);
        builder.nextIndex = backing.getStoredColumns().size();
        builder.stored(groupColumn, ColumnType.STRING);
        return builder;
    }

    public String getName() {
        return name;
    }

    public List<Column> getColumns() {
        return columns;
    }

    /**
     * Columns fetched from upstream sources, in row layout order.
     */
    public List<Column> getStoredColumns() {
        return storedColumns;
    }

    public List<String> getKeyColumns() {
        return keyColumns;
    }

    /**
     * Exact column lookup, falling back to the name without the table prefix
     * ({@code host_name} on hosts resolves to {@code name}). Returns null if unknown.
     */
    public Column getColumn(String columnName) {
        Column column = columnsByName.get(columnName);
        if (column == null && prefix != null && columnName.startsWith(prefix)) {
            column = columnsByName.get(columnName.substring(prefix.length()));
        }
        return column;
    }

    /**
     * Like {@link #getColumn(String)} but returns an empty placeholder for unknown names.
     */
    public Column getColumnOrEmpty(String columnName) {
        Column column = getColumn(columnName);
        return column != null ? column : Column.empty(columnName);
    }

    /**
     * Key of a row, key column values joined with {@code ;}.
     */
    public String keyOf(Row row) {
        if (keyIndexes.size() == 1) {
            Object value = row.get(keyIndexes.get(0));
            return value == null ? "" : value.toString();
        }
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < keyIndexes.size(); i++) {
            if (i > 0) {
                key.append(';');
            }
            Object value = row.get(keyIndexes.get(i));
            key.append(value == null ? "" : value);
        }
        return key.toString();
    }

    public boolean isVirtual() {
        return virtual;
    }

    public boolean isGroupBy() {
        return backingTable != null;
    }

    public boolean isPassthroughOnly() {
        return passthroughOnly;
    }

    /**
     * Whether peers keep a local copy of this table.
     */
    public boolean isMirrored() {
        return !virtual && !passthroughOnly && backingTable == null;
    }

    public Table getBackingTable() {
        return backingTable;
    }

    public Column getExplodeColumn() {
        return explodeColumn;
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Collects columns in declaration order; stored columns get consecutive indexes.
     */
    public static class Builder {
        private final String name;
        private final Map<String, Column> columns = new LinkedHashMap<>();
        private final List<String> keyColumns = new ArrayList<>();
        private String prefix;
        private boolean virtual;
        private boolean passthroughOnly;
        private Table backingTable;
        private Column explodeColumn;
        private int nextIndex;

        private Builder(String name) {
            this.name = name;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder key(String... columnNames) {
            keyColumns.clear();
            keyColumns.addAll(List.of(columnNames));
            return this;
        }

        public Builder virtualTable() {
            this.virtual = true;
            return this;
        }

        public Builder passthroughOnly() {
            this.passthroughOnly = true;
            return this;
        }

        public Builder stored(String columnName, ColumnType type) {
            columns.put(columnName, Column.stored(columnName, type, nextIndex++));
            return this;
        }

        public Builder string(String... columnNames) {
            for (String columnName : columnNames) {
                stored(columnName, ColumnType.STRING);
            }
            return this;
        }

        public Builder number(String... columnNames) {
            for (String columnName : columnNames) {
                stored(columnName, ColumnType.NUMBER);
            }
            return this;
        }

        public Builder time(String... columnNames) {
            for (String columnName : columnNames) {
                stored(columnName, ColumnType.TIME);
            }
            return this;
        }

        public Builder stringList(String... columnNames) {
            for (String columnName : columnNames) {
                stored(columnName, ColumnType.STRING_LIST);
            }
            return this;
        }

        public Builder numberList(String... columnNames) {
            for (String columnName : columnNames) {
                stored(columnName, ColumnType.NUMBER_LIST);
            }
            return this;
        }

        public Builder map(String columnName) {
            return stored(columnName, ColumnType.MAP);
        }

        /**
         * Add reference columns {@code <refPrefix><target>} reading {@code target} from the
         * row of {@code refTable} whose key equals this table's {@code keyColumn}.
         */
        public Builder references(Table refTable, String keyColumn, String refPrefix, String... targets) {
            Column key = columns.get(keyColumn);
            if (key == null || !key.isStored()) {
                throw new IllegalArgumentException("Reference key " + keyColumn + " is not a stored column of " + name);
            }
            for (String target : targets) {
                Column targetColumn = refTable.getColumn(target);
                if (targetColumn == null) {
                    throw new IllegalArgumentException("Unknown column " + target + " in " + refTable.getName());
                }
                String columnName = refPrefix + target;
                columns.put(columnName, Column.reference(columnName, refTable.getName(), key.getIndex(), targetColumn));
            }
            return this;
        }

        public Builder virtual(String columnName, ColumnType type, Column.VirtualResolver resolver) {
            columns.put(columnName, Column.virtual(columnName, type, resolver));
            return this;
        }

        public Table build() {
            for (String key : keyColumns) {
                Column column = columns.get(key);
                if (column == null || !column.isStored()) {
                    throw new IllegalArgumentException("Key column " + key + " of " + name + " must be stored");
                }
            }
            return new Table(this);
        }
    }
}
