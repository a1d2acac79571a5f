package com.eventsync.domain.exception;

/**
 * Base class for failures while loading sources, scraping or submitting events.
 */
public class ScrapeException extends Exception {

    public ScrapeException(String message) {
        super(message);
    }

    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
