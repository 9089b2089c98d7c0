package com.livemux.query;

import com.livemux.schema.Column;
import com.livemux.schema.ColumnType;
import com.livemux.store.QueryScope;
import com.livemux.store.Row;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Node of a filter tree, bound to the columns of one table.
 *
 * A node is either a leaf comparison ({@code state != 1}), a group combining its children
 * with And/Or, or, inside a Stats list, a numeric reducer ({@code avg latency}). Literals are
 * coerced to the column type once when the node is built; the text as written is kept so the
 * request can be serialized back unchanged.
 *
 * Instances are immutable and may be evaluated from any number of threads.
 */
public class Filter {

    private final String columnName;
    private final Column column;
    private final FilterOperator operator;
    private final String strValue;
    private final double numValue;
    private final Pattern regex;
    private final String customTag;
    private final GroupOperator groupOperator;
    private final List<Filter> children;
    private final StatsType statsType;

    private Filter(String columnName, Column column, FilterOperator operator, String strValue,
                   double numValue, Pattern regex, String customTag,
                   GroupOperator groupOperator, List<Filter> children, StatsType statsType) {
        this.columnName = columnName;
        this.column = column;
        this.operator = operator;
        this.strValue = strValue;
        this.numValue = numValue;
        this.regex = regex;
        this.customTag = customTag;
        this.groupOperator = groupOperator;
        this.children = children;
        this.statsType = statsType;
    }

    /**
     * Leaf comparison.
     *
     * @param columnName column name as written by the client
     * @param customTag  map key for map columns, null otherwise
     * @param regex      compiled pattern for regex operators, null otherwise
     */
    public static Filter leaf(String columnName, Column column, FilterOperator operator, String strValue,
                              double numValue, Pattern regex, String customTag) {
        return new Filter(columnName, column, operator, strValue, numValue, regex, customTag,
                null, Collections.emptyList(), StatsType.COUNTER);
    }

    public static Filter group(GroupOperator groupOperator, List<Filter> children) {
        return new Filter(null, null, null, "", 0, null, null,
                groupOperator, List.copyOf(children), StatsType.COUNTER);
    }

    /**
     * Stats reducer over a numeric column, e.g. {@code sum latency}.
     */
    public static Filter reducer(StatsType type, String columnName, Column column) {
        if (!type.isReducer()) {
            throw new IllegalArgumentException("Not a reducer: " + type);
        }
        return new Filter(columnName, column, null, "", 0, null, null,
                null, Collections.emptyList(), type);
    }

    /**
     * Evaluate against one row. Reducers always match.
     */
    public boolean matches(Row row, QueryScope scope) {
        if (groupOperator == GroupOperator.AND) {
            for (Filter child : children) {
                if (!child.matches(row, scope)) {
                    return false;
                }
            }
            return true;
        }
        if (groupOperator == GroupOperator.OR) {
            for (Filter child : children) {
                if (child.matches(row, scope)) {
                    return true;
                }
            }
            return false;
        }
        if (statsType.isReducer()) {
            return true;
        }
        return matchesValue(column.value(row, scope));
    }

    boolean matchesValue(Object value) {
        switch (column.getType()) {
            case NUMBER:
            case TIME:
                return matchesNumber(ColumnType.toNumber(value).doubleValue());
            case STRING_LIST:
            case NUMBER_LIST:
                return matchesList(value instanceof List ? (List<?>) value : Collections.emptyList());
            case MAP:
                return matchesMap(value instanceof Map ? (Map<?, ?>) value : Collections.emptyMap());
            default:
                return matchesString(value == null ? "" : value.toString());
        }
    }

    private boolean matchesNumber(double actual) {
        switch (operator) {
            case EQUAL:
            case EQUAL_NOCASE:
                return actual == numValue;
            case UNEQUAL:
            case UNEQUAL_NOCASE:
                return actual != numValue;
            case LESS:
                return actual < numValue;
            case LESS_EQUAL:
                return actual <= numValue;
            case GREATER:
                return actual > numValue;
            case GREATER_EQUAL:
                return actual >= numValue;
            default:
                return false;
        }
    }

    private boolean matchesString(String actual) {
        switch (operator) {
            case EQUAL:
                return actual.equals(strValue);
            case UNEQUAL:
                return !actual.equals(strValue);
            case EQUAL_NOCASE:
                return actual.equalsIgnoreCase(strValue);
            case UNEQUAL_NOCASE:
                return !actual.equalsIgnoreCase(strValue);
            case REGEX_MATCH:
            case REGEX_MATCH_NOCASE:
                return regex.matcher(actual).find();
            case REGEX_NO_MATCH:
            case REGEX_NO_MATCH_NOCASE:
                return !regex.matcher(actual).find();
            case LESS:
                return actual.compareTo(strValue) < 0;
            case LESS_EQUAL:
                return actual.compareTo(strValue) <= 0;
            case GREATER:
                return actual.compareTo(strValue) > 0;
            case GREATER_EQUAL:
                return actual.compareTo(strValue) >= 0;
            default:
                return false;
        }
    }

    /**
     * List columns use membership semantics instead of ordering.
     */
    private boolean matchesList(List<?> actual) {
        switch (operator) {
            case EQUAL:
                return strValue.isEmpty() ? actual.isEmpty() : contains(actual, false);
            case UNEQUAL:
                return strValue.isEmpty() ? !actual.isEmpty() : !contains(actual, false);
            case GREATER_EQUAL:
                return contains(actual, false);
            case LESS:
                return !contains(actual, false);
            case LESS_EQUAL:
            case EQUAL_NOCASE:
                return contains(actual, true);
            case GREATER:
            case UNEQUAL_NOCASE:
                return !contains(actual, true);
            case REGEX_MATCH:
            case REGEX_MATCH_NOCASE:
                return anyMatches(actual);
            case REGEX_NO_MATCH:
            case REGEX_NO_MATCH_NOCASE:
                return !anyMatches(actual);
            default:
                return false;
        }
    }

    private boolean contains(List<?> actual, boolean ignoreCase) {
        boolean numeric = column.getType() == ColumnType.NUMBER_LIST;
        for (Object element : actual) {
            if (numeric) {
                if (ColumnType.toNumber(element).doubleValue() == numValue) {
                    return true;
                }
            } else {
                String text = element == null ? "" : element.toString();
                if (ignoreCase ? text.equalsIgnoreCase(strValue) : text.equals(strValue)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean anyMatches(List<?> actual) {
        for (Object element : actual) {
            if (regex.matcher(element == null ? "" : element.toString()).find()) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesMap(Map<?, ?> actual) {
        Object found = actual.get(customTag);
        if (found == null) {
            found = actual.get(customTag.toUpperCase(Locale.ROOT));
        }
        if (found == null) {
            return operator.isNegated();
        }
        return matchesString(found.toString());
    }

    /**
     * Whether an upstream source can evaluate this node, i.e. every leaf reads a stored column.
     */
    public boolean isPushable() {
        if (isGroup()) {
            for (Filter child : children) {
                if (!child.isPushable()) {
                    return false;
                }
            }
            return true;
        }
        return column.isStored();
    }

    /**
     * Append this node in request syntax. Groups are written after their children,
     * e.g. {@code Filter}, {@code Filter}, {@code Or: 2}; {@code prefix} selects the header family
     * ({@code Filter}, {@code Stats} or {@code WaitCondition}).
     */
    public void appendTo(StringBuilder sb, String prefix) {
        if (isGroup()) {
            for (Filter child : children) {
                child.appendTo(sb, prefix);
            }
            sb.append(groupHeader(prefix, groupOperator)).append(": ").append(children.size()).append('\n');
            return;
        }
        sb.append(prefix).append(": ");
        if (statsType.isReducer()) {
            sb.append(statsType.getValue()).append(' ').append(columnName).append('\n');
            return;
        }
        sb.append(columnName).append(' ').append(operator.getValue());
        if (customTag != null) {
            sb.append(' ').append(customTag);
        }
        if (!strValue.isEmpty()) {
            sb.append(' ').append(strValue);
        }
        sb.append('\n');
    }

    static String groupHeader(String prefix, GroupOperator groupOperator) {
        return "Filter".equals(prefix) ? groupOperator.getValue() : prefix + groupOperator.getValue();
    }

    public boolean isGroup() {
        return groupOperator != null;
    }

    public String getColumnName() {
        return columnName;
    }

    public Column getColumn() {
        return column;
    }

    public FilterOperator getOperator() {
        return operator;
    }

    public String getStrValue() {
        return strValue;
    }

    public double getNumValue() {
        return numValue;
    }

    public GroupOperator getGroupOperator() {
        return groupOperator;
    }

    public List<Filter> getChildren() {
        return children;
    }

    public StatsType getStatsType() {
        return statsType;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, "Filter");
        return sb.toString().trim();
    }
}
