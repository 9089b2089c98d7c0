package com.livemux.stats;

import com.livemux.query.Filter;
import com.livemux.query.StatsType;
import com.livemux.store.QueryScope;
import com.livemux.store.Row;

/**
 * Running state of one Stats entry.
 *
 * Counters count matching rows. Reducers keep sum, count, min and max over numeric values
 * only, so partial states from different peers can be merged exactly: {@code avg} is
 * recombined from the merged sum and count, never from per-peer averages.
 */
public class StatsAccumulator {

    private final Filter spec;
    private long count;
    private double sum;
    private double min;
    private double max;

    public StatsAccumulator(Filter spec) {
        this.spec = spec;
    }

    public void accept(Row row, QueryScope scope) {
        if (spec.getStatsType().isReducer()) {
            add(spec.getColumn().value(row, scope));
        } else if (spec.matches(row, scope)) {
            count++;
        }
    }

    /**
     * Feed one column value to a reducer. Values that are not numbers contribute nothing.
     */
    public void add(Object value) {
        if (!(value instanceof Number)) {
            return;
        }
        double number = ((Number) value).doubleValue();
        if (count == 0) {
            min = number;
            max = number;
        } else {
            min = Math.min(min, number);
            max = Math.max(max, number);
        }
        sum += number;
        count++;
    }

    /**
     * Fold the state of an accumulator for the same Stats entry into this one.
     */
    public void merge(StatsAccumulator other) {
        if (other.count == 0) {
            return;
        }
        if (count == 0) {
            min = other.min;
            max = other.max;
        } else {
            min = Math.min(min, other.min);
            max = Math.max(max, other.max);
        }
        sum += other.sum;
        count += other.count;
    }

    /**
     * Final value: counters as Long, reducers as Double, 0 when nothing was seen.
     */
    public Object result() {
        switch (spec.getStatsType()) {
            case COUNTER:
                return count;
            case SUM:
                return sum;
            case AVG:
                return count == 0 ? 0.0 : sum / count;
            case MIN:
                return count == 0 ? 0.0 : min;
            case MAX:
                return count == 0 ? 0.0 : max;
            default:
                throw new IllegalStateException("Unhandled stats type " + spec.getStatsType());
        }
    }

    public StatsType getType() {
        return spec.getStatsType();
    }

    public long getCount() {
        return count;
    }

    public double getSum() {
        return sum;
    }
}
