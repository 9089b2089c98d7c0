package com.livemux.query;

import com.livemux.schema.ColumnType;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orders response rows by the sort fields of a request.
 * Numbers compare numerically, text lexically, lists by their joined text and map columns by
 * the value stored under the sort field's key.
 */
public class RowComparator implements Comparator<List<Object>> {

    private final List<SortField> fields;

    public RowComparator(List<SortField> fields) {
        this.fields = fields;
    }

    @Override
    public int compare(List<Object> left, List<Object> right) {
        for (SortField field : fields) {
            int index = field.getIndex();
            Object a = index < left.size() ? left.get(index) : null;
            Object b = index < right.size() ? right.get(index) : null;
            int result = compareValues(a, b, field.getArgs());
            if (result != 0) {
                return field.isAscending() ? result : -result;
            }
        }
        return 0;
    }

    static int compareValues(Object a, Object b, String key) {
        if (a instanceof Map || b instanceof Map) {
            return compareValues(mapValue(a, key), mapValue(b, key), null);
        }
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Number || b instanceof Number) {
            return Double.compare(ColumnType.toNumber(a).doubleValue(), ColumnType.toNumber(b).doubleValue());
        }
        return text(a).compareTo(text(b));
    }

    private static Object mapValue(Object value, String key) {
        if (!(value instanceof Map) || key == null) {
            return null;
        }
        Map<?, ?> map = (Map<?, ?>) value;
        Object found = map.get(key);
        return found != null ? found : map.get(key.toUpperCase(Locale.ROOT));
    }

    private static String text(Object value) {
        if (value instanceof List) {
            StringBuilder sb = new StringBuilder();
            for (Object element : (List<?>) value) {
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(element);
            }
            return sb.toString();
        }
        return value.toString();
    }
}
