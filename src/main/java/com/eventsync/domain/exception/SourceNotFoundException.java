package com.eventsync.domain.exception;

public class SourceNotFoundException extends ScrapeException {

    public SourceNotFoundException(String sourceName) {
        super("source not found: " + sourceName);
    }
}
