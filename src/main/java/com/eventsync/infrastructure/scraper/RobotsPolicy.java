package com.eventsync.infrastructure.scraper;

import com.eventsync.domain.model.CancellationToken;
import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRules.RobotRulesMode;
import crawlercommons.robots.SimpleRobotRulesParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Fetches and parses {@code /robots.txt} for a site.
 *
 * <p>A missing policy (404/410), any other non-2xx answer and a body that cannot be
 * parsed all mean "allow everything". Network failures are thrown so that each
 * caller can decide whether they are fatal.
 */
public class RobotsPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RobotsPolicy.class);

    static final Duration ROBOTS_TIMEOUT = Duration.ofSeconds(10);
    private static final int MAX_ROBOTS_BYTES = 512 * 1024;

    private final HttpFetcher fetcher;
    private final SimpleRobotRulesParser parser = new SimpleRobotRulesParser();
    private final List<String> robotNames;

    public RobotsPolicy(HttpFetcher fetcher) {
        this.fetcher = fetcher;
        this.robotNames = List.of(robotName(fetcher.getUserAgent()));
    }

    /**
     * Returns the rules that apply to our user agent on the host of {@code pageUrl}.
     *
     * @throws IOException if robots.txt cannot be fetched (network error, timeout, cancellation)
     */
    public BaseRobotRules fetchRules(String pageUrl, CancellationToken token) throws IOException {
        String robotsUrl = robotsUrlFor(pageUrl);
        FetchedPage response = fetcher.get(robotsUrl, ROBOTS_TIMEOUT, MAX_ROBOTS_BYTES, token);
        int status = response.statusCode();

        if (status == 404 || status == 410) {
            logger.debug("No robots.txt at {} ({}), allowing all", robotsUrl, status);
            return allowAll();
        }
        if (!response.isSuccess()) {
            logger.debug("robots.txt at {} answered {}, allowing all", robotsUrl, status);
            return allowAll();
        }

        try {
            return parser.parseContent(robotsUrl, response.body(), response.contentType(), robotNames);
        } catch (RuntimeException e) {
            logger.debug("Unparseable robots.txt at {}, allowing all: {}", robotsUrl, e.getMessage());
            return allowAll();
        }
    }

    /**
     * Convenience check for a single URL.
     */
    public boolean isAllowed(String pageUrl, CancellationToken token) throws IOException {
        return fetchRules(pageUrl, token).isAllowed(pageUrl);
    }

    public static BaseRobotRules allowAll() {
        return new SimpleRobotRules(RobotRulesMode.ALLOW_ALL);
    }

    static String robotsUrlFor(String pageUrl) {
        URI uri = URI.create(pageUrl);
        return uri.getScheme() + "://" + uri.getRawAuthority() + "/robots.txt";
    }

    /**
     * Product token of a user agent string, e.g. {@code "eventsync-scraper"} for
     * {@code "EventSync-Scraper/0.1 (+https://...)"}.
     */
    static String robotName(String userAgent) {
        String token = userAgent;
        int slash = token.indexOf('/');
        if (slash > 0) {
            token = token.substring(0, slash);
        }
        int space = token.indexOf(' ');
        if (space > 0) {
            token = token.substring(0, space);
        }
        return token.trim().toLowerCase(Locale.ROOT);
    }
}
