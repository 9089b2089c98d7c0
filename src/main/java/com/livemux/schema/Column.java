package com.livemux.schema;

import com.livemux.store.QueryScope;
import com.livemux.store.Row;

/**
 * Column of a table. Immutable once the schema is built.
 *
 * A column is one of:
 * <ul>
 *   <li>stored: read from the row at its positional index</li>
 *   <li>reference: read from a row of another table of the same peer, addressed by a key
 *       column of this row (e.g. {@code host_alias} on services)</li>
 *   <li>virtual: computed from the peer the row belongs to (e.g. {@code peer_key})</li>
 *   <li>empty: placeholder for unknown names, always null</li>
 * </ul>
 */
public class Column {

    public enum Kind { STORED, REFERENCE, VIRTUAL, EMPTY }

    /**
     * Computes the value of a virtual column.
     */
    @FunctionalInterface
    public interface VirtualResolver {
        Object resolve(Row row, QueryScope scope);
    }

    private final String name;
    private final ColumnType type;
    private final Kind kind;
    private final int index;
    private final String refTable;
    private final int refKeyIndex;
    private final Column refTarget;
    private final VirtualResolver resolver;

    private Column(String name, ColumnType type, Kind kind, int index,
                   String refTable, int refKeyIndex, Column refTarget, VirtualResolver resolver) {
        this.name = name;
        this.type = type;
        this.kind = kind;
        this.index = index;
        this.refTable = refTable;
        this.refKeyIndex = refKeyIndex;
        this.refTarget = refTarget;
        this.resolver = resolver;
    }

    public static Column stored(String name, ColumnType type, int index) {
        return new Column(name, type, Kind.STORED, index, null, -1, null, null);
    }

    public static Column reference(String name, String refTable, int refKeyIndex, Column refTarget) {
        return new Column(name, refTarget.getType(), Kind.REFERENCE, -1, refTable, refKeyIndex, refTarget, null);
    }

    public static Column virtual(String name, ColumnType type, VirtualResolver resolver) {
        return new Column(name, type, Kind.VIRTUAL, -1, null, -1, null, resolver);
    }

    public static Column empty(String name) {
        return new Column(name, ColumnType.STRING, Kind.EMPTY, -1, null, -1, null, null);
    }

    /**
     * Value of this column for the given row.
     */
    public Object value(Row row, QueryScope scope) {
        switch (kind) {
            case STORED:
                Object value = row.get(index);
                return value == null ? type.emptyValue() : value;
            case REFERENCE:
                Object key = row.get(refKeyIndex);
                Row target = key == null ? null : scope.lookup(refTable, key.toString());
                return target == null ? type.emptyValue() : refTarget.value(target, scope);
            case VIRTUAL:
                return resolver.resolve(row, scope);
            default:
                return null;
        }
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isStored() {
        return kind == Kind.STORED;
    }

    /**
     * Position within the stored row layout, -1 for computed columns.
     */
    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return name;
    }
}
