package com.livemux.peer;

import com.livemux.query.Filter;
import com.livemux.query.Request;
import com.livemux.query.RowComparator;
import com.livemux.schema.Column;
import com.livemux.schema.Table;
import com.livemux.stats.StatsEngine;
import com.livemux.store.QueryScope;
import com.livemux.store.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a request against rows of a single peer: filter, then either accumulate stats
 * or project, sort and cut to offset and limit.
 */
final class LocalExecutor {

    private LocalExecutor() {
    }

    static PeerResult execute(String peerKey, Request request, List<Row> rows, QueryScope scope) {
        List<Row> matching = new ArrayList<>();
        for (Row row : rows) {
            if (matchesAll(request.getFilters(), row, scope)) {
                matching.add(row);
            }
        }
        if (request.isStatsQuery()) {
            return PeerResult.stats(peerKey, StatsEngine.accumulate(request, matching, scope));
        }

        List<Column> output = request.getOutputColumns();
        List<List<Object>> projected = new ArrayList<>(matching.size());
        for (Row row : matching) {
            List<Object> values = new ArrayList<>(output.size());
            for (Column column : output) {
                values.add(column.value(row, scope));
            }
            projected.add(values);
        }
        if (!request.getSort().isEmpty()) {
            projected.sort(new RowComparator(request.getSort()));
        }
        return PeerResult.rows(peerKey, ResultMerger.slice(projected, request.getOffset(), request.getLimit()),
            projected.size());
    }

    static boolean matchesAll(List<Filter> filters, Row row, QueryScope scope) {
        for (Filter filter : filters) {
            if (!filter.matches(row, scope)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Rows of a group-by table: one copy of every backing row per element of the exploded
     * column, with the element appended as group column.
     */
    static List<Row> explode(Table groupTable, List<Row> backingRows, QueryScope scope) {
        Column explodeColumn = groupTable.getExplodeColumn();
        List<Row> exploded = new ArrayList<>();
        for (Row row : backingRows) {
            Object value = explodeColumn.value(row, scope);
            if (!(value instanceof List)) {
                continue;
            }
            for (Object element : (List<?>) value) {
                exploded.add(row.append(element == null ? "" : element.toString()));
            }
        }
        return exploded;
    }
}
