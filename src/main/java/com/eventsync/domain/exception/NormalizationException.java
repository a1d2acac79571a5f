package com.eventsync.domain.exception;

/**
 * A raw record cannot be turned into an event, e.g. it has no name or start date.
 * Never fatal for a run: the record is skipped and counted.
 */
public class NormalizationException extends ScrapeException {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
