package com.eventsync.domain.exception;

/**
 * HTTP 429 from the ingest API. Kept apart from other ingest failures so callers
 * can back off; nothing here retries.
 */
public class RateLimitedException extends IngestException {

    public RateLimitedException(String bodySnippet) {
        super("rate limited (HTTP 429): " + bodySnippet, 429, bodySnippet);
    }
}
