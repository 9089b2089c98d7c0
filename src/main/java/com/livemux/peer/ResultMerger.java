package com.livemux.peer;

import com.livemux.domain.QueryResponse;
import com.livemux.query.Request;
import com.livemux.query.RowComparator;
import com.livemux.stats.StatsResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines per-peer results into one response.
 *
 * Plain rows are concatenated in peer order, sorted globally (stable) and cut to offset and
 * limit. Stats state is merged before finalizing, so averages are computed from the summed
 * {@code (sum, count)} pairs of all peers.
 */
public final class ResultMerger {

    private ResultMerger() {
    }

    public static QueryResponse merge(Request request, List<PeerResult> results) {
        Map<String, String> failed = new LinkedHashMap<>();
        for (PeerResult result : results) {
            if (result.isFailed()) {
                failed.put(result.getPeerKey(), result.getError());
            }
        }

        List<List<Object>> rows;
        long total;
        if (request.isStatsQuery()) {
            StatsResult merged = new StatsResult(request.getStats(), request.isGroupedStats());
            for (PeerResult result : results) {
                if (!result.isFailed()) {
                    merged.merge(result.getStats());
                }
            }
            rows = merged.toRows();
            total = rows.size();
        } else {
            rows = new ArrayList<>();
            total = 0;
            for (PeerResult result : results) {
                rows.addAll(result.getRows());
                total += result.getTotal();
            }
        }

        if (!request.getSort().isEmpty()) {
            rows.sort(new RowComparator(request.getSort()));
        }
        List<List<Object>> page = slice(rows, request.getOffset(), request.getLimit());
        return new QueryResponse(request.getOutputColumnNames(), page, total, failed);
    }

    /**
     * Rows from {@code offset}, at most {@code limit} of them when a limit is given.
     */
    static <T> List<T> slice(List<T> rows, int offset, Integer limit) {
        if (offset >= rows.size()) {
            return new ArrayList<>();
        }
        int end = limit == null ? rows.size() : (int) Math.min(rows.size(), (long) offset + limit);
        return new ArrayList<>(rows.subList(offset, end));
    }
}
