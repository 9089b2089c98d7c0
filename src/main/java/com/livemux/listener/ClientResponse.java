package com.livemux.listener;

/**
 * Encoded answer to one client request.
 */
public class ClientResponse {

    private final byte[] payload;
    private final boolean keepAlive;

    public ClientResponse(byte[] payload, boolean keepAlive) {
        this.payload = payload;
        this.keepAlive = keepAlive;
    }

    public byte[] getPayload() {
        return payload;
    }

    /**
     * Whether the connection stays open for another request
     */
    public boolean isKeepAlive() {
        return keepAlive;
    }
}
