package com.livemux.peer;

/**
 * Exception thrown when an upstream source cannot be reached or answers with an error.
 */
public class UpstreamException extends RuntimeException {

    public static final int STATUS_CODE = 502;

    private final String address;

    public UpstreamException(String message, String address) {
        super(message);
        this.address = address;
    }

    public UpstreamException(String message, String address, Throwable cause) {
        super(message, cause);
        this.address = address;
    }

    /**
     * Address of the source that failed
     */
    public String getAddress() {
        return address;
    }
}
