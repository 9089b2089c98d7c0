package com.livemux.query;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.livemux.schema.Column;
import com.livemux.schema.ColumnType;
import com.livemux.schema.Table;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds {@link Filter} leaves from the value of Filter, Stats and WaitCondition lines.
 *
 * Clients tend to send the same handful of regular expressions over and over (dashboards
 * polling every few seconds), so compiled patterns are kept in a small Caffeine cache.
 */
class FilterParser {

    private static final int PATTERN_CACHE_MAX_SIZE = 1000;

    private final Cache<String, Pattern> patternCache = Caffeine.newBuilder()
            .maximumSize(PATTERN_CACHE_MAX_SIZE)
            .build();

    /**
     * Parse {@code <column> <operator> [<value>]}, or
     * {@code <map column> <operator> <key> [<value>]} for map columns.
     */
    Filter parseFilter(Table table, String value, String line) {
        String[] parts = value.split(" ", 3);
        if (parts.length < 2) {
            throw new BadRequestException(
                    "bad request: filter header, must be Filter: <field> <operator> <value>", line);
        }
        return buildLeaf(table, parts, line);
    }

    /**
     * Parse a Stats line value: either a counter filter or {@code <sum|avg|min|max> <column>}.
     */
    Filter parseStats(Table table, String value, String line) {
        String[] parts = value.split(" ", 3);
        if (parts.length == 2) {
            StatsType reducer = StatsType.reducerFromValue(parts[0].toLowerCase(Locale.ROOT));
            if (reducer != null) {
                Column column = table.getColumn(parts[1]);
                if (column == null) {
                    throw new BadRequestException(
                            "bad request: unrecognized column from stats: " + parts[1] + " in " + line, line);
                }
                return Filter.reducer(reducer, parts[1], column);
            }
        }
        if (parts.length < 2) {
            throw new BadRequestException("bad request: stats header, must be Stats: <field> <operator> <value> "
                    + "OR Stats: <sum|avg|min|max> <field>", line);
        }
        return buildLeaf(table, parts, line);
    }

    private Filter buildLeaf(Table table, String[] parts, String line) {
        String columnName = parts[0];
        FilterOperator operator = FilterOperator.fromValue(parts[1]);
        if (operator == null) {
            throw new BadRequestException(
                    "bad request: unrecognized filter operator: " + parts[1] + " in " + line, line);
        }
        String literal = parts.length > 2 ? parts[2].trim() : "";
        Column column = table.getColumnOrEmpty(columnName);
        ColumnType type = column.getType();

        String customTag = null;
        if (type == ColumnType.MAP) {
            if (literal.isEmpty()) {
                throw new BadRequestException("bad request: custom variable filter must have form "
                        + "\"Filter: custom_variables <op> <variable> [<value>]\" in " + line, line);
            }
            String[] tagParts = literal.split(" ", 2);
            customTag = tagParts[0];
            literal = tagParts.length > 1 ? tagParts[1].trim() : "";
        }

        Pattern regex = null;
        double number = 0;
        if (operator.isRegex()) {
            if (type.isNumeric()) {
                throw new BadRequestException("bad request: regular expression operator " + operator
                        + " not supported on numeric column " + columnName + " in " + line, line);
            }
            regex = compile(literal, operator.isCaseInsensitive(), line);
        } else if (type.isNumeric() || type == ColumnType.NUMBER_LIST) {
            number = toNumber(literal, line);
        }
        return Filter.leaf(columnName, column, operator, literal, number, regex, customTag);
    }

    private Pattern compile(String expression, boolean ignoreCase, String line) {
        String key = (ignoreCase ? "i:" : "s:") + expression;
        try {
            return patternCache.get(key, k -> ignoreCase
                    ? Pattern.compile(expression, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    : Pattern.compile(expression));
        } catch (PatternSyntaxException e) {
            throw new BadRequestException("bad request: invalid regular expression: " + e.getDescription()
                    + " in filter " + line, line);
        }
    }

    private static double toNumber(String literal, String line) {
        if (literal.isEmpty()) {
            return 0;
        }
        try {
            return Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            throw new BadRequestException(
                    "bad request: could not convert " + literal + " to number in filter " + line, line);
        }
    }
}
