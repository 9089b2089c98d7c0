package com.livemux.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Value types a column can carry.
 * Each type knows how to normalize a decoded JSON value from an upstream source
 * into the canonical Java representation used by rows.
 */
public enum ColumnType {

    /** Plain text, stored as {@link String}. */
    STRING,

    /** Integer or floating point number, stored as {@link Long} or {@link Double}. */
    NUMBER,

    /** Unix timestamp in seconds, stored as {@link Long}. */
    TIME,

    /** List of strings, e.g. groups or contacts. */
    STRING_LIST,

    /** List of numbers, e.g. comment or downtime ids. */
    NUMBER_LIST,

    /** String to string map, e.g. custom variables. */
    MAP;

    public boolean isNumeric() {
        return this == NUMBER || this == TIME;
    }

    /**
     * Convert a raw decoded value to the representation of this type.
     * Unusable input degrades to the neutral value of the type.
     */
    public Object normalize(Object raw) {
        switch (this) {
            case STRING:
                return raw == null ? "" : raw.toString();
            case NUMBER:
                return toNumber(raw);
            case TIME:
                return toNumber(raw).longValue();
            case STRING_LIST:
                return toStringList(raw);
            case NUMBER_LIST:
                return toNumberList(raw);
            case MAP:
                return toMap(raw);
            default:
                throw new IllegalStateException("Unhandled column type " + this);
        }
    }

    /**
     * Neutral value used for missing data.
     */
    public Object emptyValue() {
        return normalize(null);
    }

    public static Number toNumber(Object raw) {
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            return Double.isFinite(d) ? d : 0L;
        }
        if (raw instanceof Number) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Boolean) {
            return ((Boolean) raw) ? 1L : 0L;
        }
        if (raw instanceof String) {
            String s = ((String) raw).trim();
            if (s.isEmpty()) {
                return 0L;
            }
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException e) {
                try {
                    return Double.parseDouble(s);
                } catch (NumberFormatException ignored) {
                    return 0L;
                }
            }
        }
        return 0L;
    }

    private static List<String> toStringList(Object raw) {
        if (!(raw instanceof List)) {
            return Collections.emptyList();
        }
        List<String> values = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            values.add(item == null ? "" : item.toString());
        }
        return Collections.unmodifiableList(values);
    }

    private static List<Number> toNumberList(Object raw) {
        if (!(raw instanceof List)) {
            return Collections.emptyList();
        }
        List<Number> values = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            values.add(toNumber(item));
        }
        return Collections.unmodifiableList(values);
    }

    private static Map<String, String> toMap(Object raw) {
        Map<String, String> values = new LinkedHashMap<>();
        if (raw instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
                values.put(String.valueOf(entry.getKey()),
                        entry.getValue() == null ? "" : entry.getValue().toString());
            }
        } else if (raw instanceof List) {
            // older sources send custom variables as [[key, value], ...]
            for (Object item : (List<?>) raw) {
                if (item instanceof List && ((List<?>) item).size() >= 2) {
                    List<?> pair = (List<?>) item;
                    values.put(String.valueOf(pair.get(0)), String.valueOf(pair.get(1)));
                }
            }
        }
        return Collections.unmodifiableMap(values);
    }
}
