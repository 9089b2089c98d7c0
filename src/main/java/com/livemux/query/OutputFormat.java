package com.livemux.query;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Encoding of a query response body.
 */
public enum OutputFormat {

    /**
     * Plain array of rows
     */
    JSON("json"),

    /**
     * Object carrying columns, data, total and failed peers
     */
    WRAPPED_JSON("wrapped_json");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @return the format, or null if unrecognized
     */
    public static OutputFormat fromValue(String value) {
        for (OutputFormat format : OutputFormat.values()) {
            if (format.value.equals(value)) {
                return format;
            }
        }
        return null;
    }
}
