package com.livemux.query;

import com.livemux.schema.SchemaRegistry;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Names accepted by the WaitTrigger header and the tables each one watches.
 *
 * Besides {@code all} and plain table names the Livestatus keywords are understood:
 * {@code check} and {@code state} fire on host and service updates, {@code downtime},
 * {@code comment} and {@code program} on their table, {@code log} and {@code command}
 * on any refresh.
 */
public final class WaitTriggers {

    public static final String ALL = "all";

    private static final Set<String> ANY_TABLE = Collections.emptySet();

    private static final Map<String, Set<String>> KEYWORDS = Map.of(
            ALL, ANY_TABLE,
            "check", Set.of("hosts", "services"),
            "state", Set.of("hosts", "services"),
            "downtime", Set.of("downtimes"),
            "comment", Set.of("comments"),
            "program", Set.of("status"),
            "log", ANY_TABLE,
            "command", ANY_TABLE);

    private WaitTriggers() {
    }

    public static boolean isKnown(String trigger, SchemaRegistry schema) {
        return KEYWORDS.containsKey(trigger) || schema.getTable(trigger) != null;
    }

    /**
     * Whether a refresh cycle that updated {@code refreshedTables} can affect waiters
     * registered under {@code trigger}.
     */
    public static boolean fires(String trigger, Set<String> refreshedTables) {
        Set<String> watched = KEYWORDS.get(trigger);
        if (watched == null) {
            return refreshedTables.contains(trigger);
        }
        if (watched.isEmpty()) {
            return true;
        }
        for (String table : watched) {
            if (refreshedTables.contains(table)) {
                return true;
            }
        }
        return false;
    }
}
