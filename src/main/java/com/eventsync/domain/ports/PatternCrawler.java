package com.eventsync.domain.ports;

import com.eventsync.domain.exception.ScrapeException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.RawEvent;
import com.eventsync.domain.model.SourceConfig;

import java.util.List;

/**
 * Port for tier 1 scraping: CSS selectors applied to a listing and its pagination.
 */
public interface PatternCrawler {

    /**
     * Crawls the source URL and its pagination targets within the same host.
     * Blocks until every queued page has been visited.
     *
     * @return matched items with a non-empty name (may be empty, never null)
     * @throws ScrapeException if the first page cannot be fetched for a reason
     *                         other than cancellation
     */
    List<RawEvent> crawl(SourceConfig source, CancellationToken token) throws ScrapeException;
}
