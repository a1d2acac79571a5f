package com.eventsync.domain.exception;

public class ScrapeCancelledException extends ScrapeException {

    public ScrapeCancelledException(String message) {
        super(message);
    }

    public ScrapeCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
