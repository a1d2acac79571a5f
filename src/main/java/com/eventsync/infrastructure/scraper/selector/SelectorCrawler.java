package com.eventsync.infrastructure.scraper.selector;

import com.eventsync.domain.exception.FetchException;
import com.eventsync.domain.exception.ScrapeException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.RawEvent;
import com.eventsync.domain.model.SourceConfig;
import com.eventsync.domain.ports.PatternCrawler;
import com.eventsync.infrastructure.scraper.HttpFetcher;
import com.eventsync.infrastructure.scraper.RobotsPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Tier 1 scraper: CSS selectors over a listing page and its pagination.
 *
 * <p>The crawl never leaves the host of the source URL, always honours robots.txt
 * and waits at least the politeness delay between two fetches to that host.
 */
public class SelectorCrawler implements PatternCrawler {

    private static final Logger logger = LoggerFactory.getLogger(SelectorCrawler.class);

    private final HttpFetcher fetcher;
    private final RobotsPolicy robotsPolicy;
    private final Duration politenessDelay;
    private final Duration fetchTimeout;
    private final int callbackThreads;

    public SelectorCrawler(HttpFetcher fetcher, RobotsPolicy robotsPolicy, Duration politenessDelay,
                           Duration fetchTimeout, int callbackThreads) {
        this.fetcher = fetcher;
        this.robotsPolicy = robotsPolicy;
        this.politenessDelay = politenessDelay;
        this.fetchTimeout = fetchTimeout;
        this.callbackThreads = callbackThreads;
    }

    @Override
    public List<RawEvent> crawl(SourceConfig source, CancellationToken token) throws ScrapeException {
        if (token.isCancelled()) {
            return List.of();
        }
        String eventList = source.selectorsOrEmpty().eventList();
        if (eventList == null || eventList.isBlank()) {
            throw new ScrapeException("source " + source.getName() + " has no event_list selector");
        }

        CrawlSession session = new CrawlSession(source, hostOf(source.getUrl()), fetcher, robotsPolicy,
            politenessDelay, fetchTimeout, callbackThreads, token);
        List<RawEvent> events = session.run();
        logger.info("Crawled {} page(s) of {}, {} event(s) matched",
            session.getPagesVisited(), source.getName(), events.size());
        return events;
    }

    static String hostOf(String url) throws FetchException {
        try {
            String host = new URI(url).getHost();
            if (host == null || host.isEmpty()) {
                throw new FetchException("invalid URL " + url + ": missing host", -1);
            }
            return host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            throw new FetchException("invalid URL " + url + ": " + e.getMessage(), e);
        }
    }
}
