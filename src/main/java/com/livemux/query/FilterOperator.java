package com.livemux.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators accepted in Filter, Stats and WaitCondition lines.
 */
public enum FilterOperator {

    EQUAL("="),
    UNEQUAL("!="),
    EQUAL_NOCASE("=~"),
    UNEQUAL_NOCASE("!=~"),

    /**
     * Regular expression match, case sensitive
     */
    REGEX_MATCH("~"),
    REGEX_NO_MATCH("!~"),

    /**
     * Regular expression match, case insensitive
     */
    REGEX_MATCH_NOCASE("~~"),
    REGEX_NO_MATCH_NOCASE("!~~"),

    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">=");

    private final String value;

    FilterOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isRegex() {
        return this == REGEX_MATCH || this == REGEX_NO_MATCH
                || this == REGEX_MATCH_NOCASE || this == REGEX_NO_MATCH_NOCASE;
    }

    public boolean isCaseInsensitive() {
        return this == EQUAL_NOCASE || this == UNEQUAL_NOCASE
                || this == REGEX_MATCH_NOCASE || this == REGEX_NO_MATCH_NOCASE;
    }

    /**
     * Operators that match when the compared value is absent.
     */
    public boolean isNegated() {
        return this == UNEQUAL || this == UNEQUAL_NOCASE
                || this == REGEX_NO_MATCH || this == REGEX_NO_MATCH_NOCASE;
    }

    /**
     * @return the operator written as {@code value}, or null if there is none
     */
    public static FilterOperator fromValue(String value) {
        for (FilterOperator operator : FilterOperator.values()) {
            if (operator.value.equals(value)) {
                return operator;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
