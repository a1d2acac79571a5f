package com.eventsync.domain.exception;

/**
 * The ingest API rejected a batch or could not be reached.
 */
public class IngestException extends ScrapeException {

    private final int statusCode;
    private final String bodySnippet;

    public IngestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.bodySnippet = null;
    }

    public IngestException(String message, int statusCode, String bodySnippet) {
        super(message);
        this.statusCode = statusCode;
        this.bodySnippet = bodySnippet;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBodySnippet() {
        return bodySnippet;
    }
}
