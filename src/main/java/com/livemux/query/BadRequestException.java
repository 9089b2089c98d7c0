package com.livemux.query;

/**
 * Exception thrown when a client request cannot be parsed or validated.
 * The message is sent to the client verbatim, so its text is stable.
 */
public class BadRequestException extends RuntimeException {

    public static final int STATUS_CODE = 400;

    private final String line;

    public BadRequestException(String message) {
        super(message);
        this.line = null;
    }

    public BadRequestException(String message, String line) {
        super(message);
        this.line = line;
    }

    /**
     * The request line that caused the error, if a single line is to blame
     */
    public String getLine() {
        return line;
    }

    public int getStatusCode() {
        return STATUS_CODE;
    }
}
