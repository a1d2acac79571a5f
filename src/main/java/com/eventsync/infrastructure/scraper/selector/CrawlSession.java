package com.eventsync.infrastructure.scraper.selector;

import com.eventsync.domain.exception.FetchException;
import com.eventsync.domain.exception.RobotsDisallowedException;
import com.eventsync.domain.exception.ScrapeException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.RawEvent;
import com.eventsync.domain.model.SelectorConfig;
import com.eventsync.domain.model.SourceConfig;
import com.eventsync.infrastructure.scraper.FetchedPage;
import com.eventsync.infrastructure.scraper.HttpFetcher;
import com.eventsync.infrastructure.scraper.RobotsPolicy;
import crawlercommons.robots.BaseRobotRules;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;

/**
 * State of one tier 1 crawl: the allowed host, visited URLs, page counter and
 * collected events. Built per call and thrown away afterwards.
 *
 * <p>Each fetched page hands two callbacks to a small executor: one extracting
 * items and one following pagination. A {@link Phaser} counts outstanding
 * callbacks so that {@link #run()} returns only once the crawl has drained.
 * {@link #lock} guards the result list, the visited set and the page counter.
 */
class CrawlSession {

    private static final Logger logger = LoggerFactory.getLogger(CrawlSession.class);

    static final int MAX_BODY_BYTES = 10 * 1024 * 1024;
    static final Duration MAX_CRAWL_DELAY = Duration.ofSeconds(10);

    private final SourceConfig source;
    private final SelectorConfig selectors;
    private final String allowedHost;
    private final int maxPages;
    private final HttpFetcher fetcher;
    private final RobotsPolicy robotsPolicy;
    private final DomainRateLimiter rateLimiter;
    private final Duration fetchTimeout;
    private final CancellationToken token;
    private final ExecutorService callbacks;
    private final Phaser outstanding = new Phaser(1);

    private final Object lock = new Object();
    private final List<RawEvent> results = new ArrayList<>();
    private final Set<String> visited = new HashSet<>();
    private int pagesVisited;
    private boolean capLogged;
    private BaseRobotRules robotsRules;

    CrawlSession(SourceConfig source, String allowedHost, HttpFetcher fetcher, RobotsPolicy robotsPolicy,
                 Duration politenessDelay, Duration fetchTimeout, int callbackThreads, CancellationToken token) {
        this.source = source;
        this.selectors = source.selectorsOrEmpty();
        this.allowedHost = allowedHost;
        this.maxPages = source.getMaxPages() > 0 ? source.getMaxPages() : SourceConfig.DEFAULT_MAX_PAGES;
        this.fetcher = fetcher;
        this.robotsPolicy = robotsPolicy;
        this.rateLimiter = new DomainRateLimiter(politenessDelay);
        this.fetchTimeout = fetchTimeout;
        this.token = token;
        this.callbacks = Executors.newFixedThreadPool(Math.max(1, callbackThreads));
    }

    /**
     * Visits the seed page, then waits for every queued page and callback.
     */
    List<RawEvent> run() throws ScrapeException {
        try {
            if (token.isCancelled()) {
                return snapshot();
            }
            String seedUrl = source.getUrl();
            if (!reservePage(seedUrl)) {
                return snapshot();
            }
            Document seed;
            try {
                seed = fetchSeed(seedUrl);
            } catch (ScrapeException e) {
                if (token.isCancelled()) {
                    logger.debug("Seed fetch for {} ended by cancellation: {}", source.getName(), e.getMessage());
                    return snapshot();
                }
                throw e;
            }
            if (seed != null) {
                dispatch(seed);
            }
            awaitDrained();
            return snapshot();
        } finally {
            callbacks.shutdownNow();
        }
    }

    int getPagesVisited() {
        synchronized (lock) {
            return pagesVisited;
        }
    }

    // Fetching

    private Document fetchSeed(String url) throws ScrapeException {
        BaseRobotRules rules;
        try {
            rules = robotsRules(url);
        } catch (IOException e) {
            throw new FetchException("cannot establish robots.txt permission for " + url + ": " + e.getMessage(), e);
        }
        if (!rules.isAllowed(url)) {
            throw new RobotsDisallowedException(url);
        }
        if (!rateLimiter.acquire(allowedHost, token)) {
            return null;
        }
        try {
            return fetch(url);
        } catch (IOException e) {
            throw new FetchException("fetching " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * Follow-up pages: failures are logged and the crawl goes on.
     */
    private void visitFollowUp(String url) {
        if (token.isCancelled() || !isAllowedHost(url) || !reservePage(url)) {
            return;
        }
        try {
            if (!robotsRules(url).isAllowed(url)) {
                logger.info("Pagination target {} disallowed by robots.txt, stopping", url);
                return;
            }
            if (!rateLimiter.acquire(allowedHost, token)) {
                return;
            }
            dispatch(fetch(url));
        } catch (IOException | FetchException e) {
            if (!token.isCancelled()) {
                logger.warn("Request error for {} (source {}): {}", url, source.getName(), e.getMessage());
            }
        }
    }

    private Document fetch(String url) throws IOException, FetchException {
        logger.debug("Visiting page {} for source {}", url, source.getName());
        FetchedPage page = fetcher.get(url, fetchTimeout, MAX_BODY_BYTES, token);
        if (!page.isSuccess()) {
            throw new FetchException("unexpected status " + page.statusCode() + " fetching " + url, page.statusCode());
        }
        String charset = page.declaredCharset() != null ? page.declaredCharset().name() : null;
        return Jsoup.parse(new ByteArrayInputStream(page.body()), charset, url);
    }

    private BaseRobotRules robotsRules(String url) throws IOException {
        synchronized (lock) {
            if (robotsRules != null) {
                return robotsRules;
            }
        }
        BaseRobotRules rules = robotsPolicy.fetchRules(url, token);
        long crawlDelay = rules.getCrawlDelay();
        if (crawlDelay > 0) {
            rateLimiter.raiseDelay(Duration.ofMillis(Math.min(crawlDelay, MAX_CRAWL_DELAY.toMillis())));
        }
        synchronized (lock) {
            robotsRules = rules;
        }
        return rules;
    }

    /**
     * Counts a page against the cap. False for a repeat visit or once the cap is reached.
     */
    private boolean reservePage(String url) {
        synchronized (lock) {
            if (visited.contains(url)) {
                return false;
            }
            if (pagesVisited >= maxPages) {
                if (!capLogged) {
                    capLogged = true;
                    logger.info("Page cap of {} reached for source {}, not fetching {}", maxPages, source.getName(), url);
                }
                return false;
            }
            visited.add(url);
            pagesVisited++;
            return true;
        }
    }

    private boolean isAllowedHost(String url) {
        try {
            String host = new URI(url).getHost();
            if (host != null && host.toLowerCase(Locale.ROOT).equals(allowedHost)) {
                return true;
            }
        } catch (URISyntaxException e) {
            logger.debug("Ignoring unparseable link {}: {}", url, e.getMessage());
            return false;
        }
        logger.debug("Ignoring off-domain link {} (allowed host {})", url, allowedHost);
        return false;
    }

    // Callbacks

    private void dispatch(Document page) {
        if (page == null) {
            return;
        }
        submit(() -> extractItems(page));
        if (selectors.pagination() != null && !selectors.pagination().isBlank()) {
            submit(() -> followPagination(page));
        }
    }

    private void submit(Runnable callback) {
        outstanding.register();
        try {
            callbacks.execute(() -> {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    logger.warn("Callback failed for source {}: {}", source.getName(), e.getMessage(), e);
                } finally {
                    outstanding.arriveAndDeregister();
                }
            });
        } catch (RejectedExecutionException e) {
            outstanding.arriveAndDeregister();
            logger.debug("Callback rejected for source {}, crawl is shutting down", source.getName());
        }
    }

    private void extractItems(Document page) {
        for (Element item : page.select(selectors.eventList())) {
            if (token.isCancelled()) {
                return;
            }
            RawEvent raw = SelectorExtraction.extract(item, selectors);
            if (raw.name() == null || raw.name().isEmpty()) {
                continue;
            }
            synchronized (lock) {
                results.add(raw);
            }
        }
    }

    private void followPagination(Document page) {
        if (token.isCancelled()) {
            return;
        }
        Element link = page.selectFirst(selectors.pagination());
        if (link == null) {
            return;
        }
        String next = link.hasAttr("href") ? link.absUrl("href") : "";
        if (next.isEmpty()) {
            Element anchor = link.selectFirst("a[href]");
            next = anchor != null ? anchor.absUrl("href") : "";
        }
        if (!next.isEmpty()) {
            visitFollowUp(next);
        }
    }

    private void awaitDrained() {
        try {
            outstanding.awaitAdvanceInterruptibly(outstanding.arrive());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Crawl of {} interrupted, returning partial results", source.getName());
        }
    }

    private List<RawEvent> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(results);
        }
    }
}
