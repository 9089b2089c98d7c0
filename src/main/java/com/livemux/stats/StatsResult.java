package com.livemux.stats;

import com.livemux.query.Filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stats accumulators of one query, keyed by group.
 *
 * Without group-by columns there is a single group with an empty key, present even when no
 * row matched so an aggregate query always yields one row. Groups keep first-seen order.
 */
public class StatsResult {

    private final List<Filter> specs;
    private final Map<List<Object>, List<StatsAccumulator>> groups = new LinkedHashMap<>();

    public StatsResult(List<Filter> specs, boolean grouped) {
        this.specs = specs;
        if (!grouped) {
            accumulatorsFor(new ArrayList<>());
        }
    }

    /**
     * Accumulators of the group with the given key, created on first use.
     */
    public List<StatsAccumulator> accumulatorsFor(List<Object> key) {
        return groups.computeIfAbsent(key, k -> {
            List<StatsAccumulator> accumulators = new ArrayList<>(specs.size());
            for (Filter spec : specs) {
                accumulators.add(new StatsAccumulator(spec));
            }
            return accumulators;
        });
    }

    /**
     * Union the groups of {@code other} into this result, merging groups with equal keys.
     * Groups only known to {@code other} are appended in its order.
     */
    public void merge(StatsResult other) {
        for (Map.Entry<List<Object>, List<StatsAccumulator>> entry : other.groups.entrySet()) {
            List<StatsAccumulator> target = accumulatorsFor(entry.getKey());
            for (int i = 0; i < target.size(); i++) {
                target.get(i).merge(entry.getValue().get(i));
            }
        }
    }

    /**
     * One row per group: key values followed by the final value of every Stats entry.
     */
    public List<List<Object>> toRows() {
        List<List<Object>> rows = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, List<StatsAccumulator>> entry : groups.entrySet()) {
            List<Object> row = new ArrayList<>(entry.getKey());
            for (StatsAccumulator accumulator : entry.getValue()) {
                row.add(accumulator.result());
            }
            rows.add(row);
        }
        return rows;
    }

    public int getGroupCount() {
        return groups.size();
    }
}
