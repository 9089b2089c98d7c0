package com.livemux.stats;

import com.livemux.query.Request;
import com.livemux.schema.Column;
import com.livemux.store.QueryScope;
import com.livemux.store.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the Stats entries of a request over the rows that passed its filters.
 */
public final class StatsEngine {

    private StatsEngine() {
    }

    /**
     * @param rows rows that already matched the request's own filters
     */
    public static StatsResult accumulate(Request request, List<Row> rows, QueryScope scope) {
        boolean grouped = request.isGroupedStats();
        StatsResult result = new StatsResult(request.getStats(), grouped);
        List<Column> groupColumns = request.getOutputColumns();
        for (Row row : rows) {
            List<Object> key = new ArrayList<>(grouped ? groupColumns.size() : 0);
            if (grouped) {
                for (Column column : groupColumns) {
                    key.add(column.value(row, scope));
                }
            }
            for (StatsAccumulator accumulator : result.accumulatorsFor(key)) {
                accumulator.accept(row, scope);
            }
        }
        return result;
    }
}
