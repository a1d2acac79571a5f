package com.eventsync.domain.exception;

/**
 * The site's robots.txt explicitly disallows fetching the URL.
 */
public class RobotsDisallowedException extends ScrapeException {

    public RobotsDisallowedException(String url) {
        super("scraping disallowed by robots.txt for " + url);
    }
}
