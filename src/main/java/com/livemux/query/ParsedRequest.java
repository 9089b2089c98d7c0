package com.livemux.query;

/**
 * A request together with the amount of input it consumed.
 */
public class ParsedRequest {

    private final Request request;
    private final int consumedBytes;
    private final int end;

    public ParsedRequest(Request request, int consumedBytes, int end) {
        this.request = request;
        this.consumedBytes = consumedBytes;
        this.end = end;
    }

    public Request getRequest() {
        return request;
    }

    /**
     * UTF-8 length of the consumed text, including the terminating blank line if present
     */
    public int getConsumedBytes() {
        return consumedBytes;
    }

    /**
     * Character offset where the next request starts
     */
    public int getEnd() {
        return end;
    }
}
