package com.livemux.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Boolean combinator of a filter group.
 */
public enum GroupOperator {

    AND("And"),
    OR("Or");

    private final String value;

    GroupOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
