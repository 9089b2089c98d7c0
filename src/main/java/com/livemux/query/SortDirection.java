package com.livemux.query;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SortDirection {

    ASC("asc"),
    DESC("desc");

    private final String value;

    SortDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @return the direction, case insensitive, or null if unrecognized
     */
    public static SortDirection fromValue(String value) {
        for (SortDirection direction : SortDirection.values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return direction;
            }
        }
        return null;
    }
}
