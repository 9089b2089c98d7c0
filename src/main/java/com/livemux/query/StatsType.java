package com.livemux.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a Stats line: a counter of rows matching a filter, or a numeric reducer
 * over one column.
 */
public enum StatsType {

    COUNTER("count"),
    SUM("sum"),
    AVG("avg"),
    MIN("min"),
    MAX("max");

    private final String value;

    StatsType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isReducer() {
        return this != COUNTER;
    }

    /**
     * @return the reducer named {@code value} (lower case), or null if it is not a reducer
     */
    public static StatsType reducerFromValue(String value) {
        for (StatsType type : StatsType.values()) {
            if (type.isReducer() && type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
