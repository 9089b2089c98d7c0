package com.livemux.peer;

import com.livemux.stats.StatsResult;

import java.util.Collections;
import java.util.List;

/**
 * Partial result of one peer, before merging.
 *
 * Plain queries carry projected rows and the number of rows that matched before limiting;
 * stats queries carry unfinalized accumulator state. A peer that could not answer carries
 * its error and no data.
 */
public class PeerResult {

    private final String peerKey;
    private final List<List<Object>> rows;
    private final long total;
    private final StatsResult stats;
    private final String error;

    private PeerResult(String peerKey, List<List<Object>> rows, long total, StatsResult stats, String error) {
        this.peerKey = peerKey;
        this.rows = rows;
        this.total = total;
        this.stats = stats;
        this.error = error;
    }

    public static PeerResult rows(String peerKey, List<List<Object>> rows, long total) {
        return new PeerResult(peerKey, rows, total, null, null);
    }

    public static PeerResult stats(String peerKey, StatsResult stats) {
        return new PeerResult(peerKey, Collections.emptyList(), 0, stats, null);
    }

    public static PeerResult failed(String peerKey, String error) {
        return new PeerResult(peerKey, Collections.emptyList(), 0, null, error);
    }

    public String getPeerKey() {
        return peerKey;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    /**
     * Matching rows before offset and limit were applied
     */
    public long getTotal() {
        return total;
    }

    public StatsResult getStats() {
        return stats;
    }

    public String getError() {
        return error;
    }

    public boolean isFailed() {
        return error != null;
    }
}
