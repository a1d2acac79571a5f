package com.eventsync.domain.ports;

import com.eventsync.domain.exception.ScrapeException;
import com.eventsync.domain.model.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Port for tier 0 scraping: event nodes from the structured data embedded in a page.
 */
public interface StructuredDataExtractor {

    /**
     * Fetches the page and returns every schema.org Event / EventSeries node found
     * in its JSON-LD blocks, in document order.
     *
     * @param url   page to fetch
     * @param token cancellation signal
     * @return event nodes, each an independent copy (may be empty, never null)
     * @throws ScrapeException if the URL is invalid, robots.txt disallows it or the fetch fails
     */
    List<JsonNode> extract(String url, CancellationToken token) throws ScrapeException;
}
