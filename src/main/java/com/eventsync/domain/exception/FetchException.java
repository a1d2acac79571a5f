package com.eventsync.domain.exception;

/**
 * Transport failure: network error, timeout or unexpected HTTP status.
 */
public class FetchException extends ScrapeException {

    private final int statusCode;

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public FetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
