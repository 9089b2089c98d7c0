package com.livemux.peer;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Connection state of a peer, reported numerically in the backends table.
 */
public enum PeerStatus {

    /**
     * Last refresh succeeded
     */
    UP(0),

    /**
     * Reachable but degraded
     */
    WARNING(1),

    /**
     * Last refresh failed; queries skip this peer until it recovers
     */
    DOWN(2),

    /**
     * Source answers with data that cannot be decoded
     */
    BROKEN(3),

    /**
     * Not refreshed yet
     */
    PENDING(4);

    private final int code;

    PeerStatus(int code) {
        this.code = code;
    }

    @JsonValue
    public int getCode() {
        return code;
    }

    /**
     * Whether queries are answered from this peer's mirror.
     */
    public boolean isUsable() {
        return this == UP || this == WARNING;
    }
}
