package com.livemux.store;

import java.util.Arrays;

/**
 * One immutable row of a mirrored table.
 * Values are positionally aligned with the stored columns of the owning table.
 */
public final class Row {

    private final Object[] values;

    public Row(Object[] values) {
        this.values = values;
    }

    /**
     * Value at the given position, or null when the row is shorter than the layout.
     */
    public Object get(int index) {
        return index >= 0 && index < values.length ? values[index] : null;
    }

    public int size() {
        return values.length;
    }

    /**
     * Copy of this row with one extra trailing value, used by group-by tables.
     */
    public Row append(Object value) {
        Object[] extended = Arrays.copyOf(values, values.length + 1);
        extended[values.length] = value;
        return new Row(extended);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
