package com.livemux.query;

import java.util.Objects;

/**
 * Represents a sort field with direction.
 * The index points into the response columns and is resolved once the output columns
 * of the request are known.
 */
public class SortField {

    private final String name;
    private final SortDirection direction;
    private final String args;
    private int index = -1;

    public SortField(String name, SortDirection direction) {
        this(name, direction, null);
    }

    /**
     * @param args sub-key for map columns, e.g. the custom variable name
     */
    public SortField(String name, SortDirection direction, String args) {
        this.name = name;
        this.direction = direction;
        this.args = args;
    }

    public String getName() {
        return name;
    }

    public SortDirection getDirection() {
        return direction;
    }

    public boolean isAscending() {
        return direction == SortDirection.ASC;
    }

    public String getArgs() {
        return args;
    }

    public int getIndex() {
        return index;
    }

    void setIndex(int index) {
        this.index = index;
    }

    SortField copy() {
        SortField copy = new SortField(name, direction, args);
        copy.index = index;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SortField)) {
            return false;
        }
        SortField that = (SortField) o;
        return index == that.index
                && name.equals(that.name)
                && direction == that.direction
                && Objects.equals(args, that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, direction, args, index);
    }

    @Override
    public String toString() {
        return args == null
                ? name + " " + direction.getValue()
                : name + " " + args + " " + direction.getValue();
    }
}
