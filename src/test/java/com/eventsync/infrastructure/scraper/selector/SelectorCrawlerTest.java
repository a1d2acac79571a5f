package com.eventsync.infrastructure.scraper.selector;

import com.eventsync.domain.exception.FetchException;
import com.eventsync.domain.exception.RobotsDisallowedException;
import com.eventsync.domain.exception.ScrapeException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.RawEvent;
import com.eventsync.domain.model.SelectorConfig;
import com.eventsync.domain.model.SourceConfig;
import com.eventsync.infrastructure.scraper.FakeHttpFetcher;
import com.eventsync.infrastructure.scraper.RobotsPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SelectorCrawler.
 */
class SelectorCrawlerTest {

    private static final String BASE = "https://venue.example";
    private static final String SEED = BASE + "/events?page=1";

    private static final SelectorConfig SELECTORS = new SelectorConfig(
        ".event", "h3", "time.start", "time.end", ".venue", ".summary", "a.details", "img", "a.next");

    private FakeHttpFetcher fetcher;
    private SelectorCrawler crawler;

    @BeforeEach
    void setUp() {
        fetcher = new FakeHttpFetcher();
        crawler = new SelectorCrawler(fetcher, new RobotsPolicy(fetcher), Duration.ZERO, Duration.ofSeconds(5), 2);
    }

    private static SourceConfig source(int maxPages) {
        return SourceConfig.builder()
            .name("venue")
            .url(SEED)
            .tier(SourceConfig.TIER_SELECTORS)
            .maxPages(maxPages)
            .selectors(SELECTORS)
            .build();
    }

    private static String card(String name) {
        return "<div class=\"event\"><h3>" + name + "</h3>"
            + "<time class=\"start\" datetime=\"2025-06-01T19:00\">June 1</time>"
            + "<a class=\"details\" href=\"/e/" + name.toLowerCase() + "\">More</a></div>";
    }

    private static String listing(String nextHref, String... names) {
        StringBuilder html = new StringBuilder("<html><body>");
        for (String name : names) {
            html.append(card(name));
        }
        if (nextHref != null) {
            html.append("<a class=\"next\" href=\"").append(nextHref).append("\">Next</a>");
        }
        return html.append("</body></html>").toString();
    }

    private static Set<String> names(List<RawEvent> events) {
        return events.stream().map(RawEvent::name).collect(Collectors.toSet());
    }

    @Test
    void testFollowsPaginationWithinHost() throws ScrapeException {
        fetcher.html(SEED, listing("/events?page=2", "Alpha", "Beta"))
            .html(BASE + "/events?page=2", listing("/events?page=3", "Gamma"))
            .html(BASE + "/events?page=3", listing(null, "Delta"));

        List<RawEvent> events = crawler.crawl(source(10), CancellationToken.none());

        assertEquals(Set.of("Alpha", "Beta", "Gamma", "Delta"), names(events));
        assertEquals(3, fetcher.getRequestedPages().size());
    }

    @Test
    void testPageCapLimitsFetches() throws ScrapeException {
        for (int i = 1; i <= 5; i++) {
            fetcher.html(BASE + "/events?page=" + i, listing("/events?page=" + (i + 1), "Event" + i));
        }

        List<RawEvent> events = crawler.crawl(source(2), CancellationToken.none());

        assertEquals(2, fetcher.getRequestedPages().size());
        assertEquals(Set.of("Event1", "Event2"), names(events));
    }

    @Test
    void testOffDomainPaginationIsIgnored() throws ScrapeException {
        fetcher.html(SEED, listing("https://other.example/events?page=2", "Local"))
            .html("https://other.example/events?page=2", listing(null, "Foreign"));

        List<RawEvent> events = crawler.crawl(source(10), CancellationToken.none());

        assertEquals(Set.of("Local"), names(events));
        assertEquals(List.of(SEED), fetcher.getRequestedPages());
    }

    @Test
    void testSelfLinkIsVisitedOnce() throws ScrapeException {
        fetcher.html(SEED, listing(SEED, "Only"));

        List<RawEvent> events = crawler.crawl(source(10), CancellationToken.none());

        assertEquals(1, events.size());
        assertEquals(1, fetcher.getRequestedPages().size());
    }

    @Test
    void testExtractsFieldsPreferringDatetimeAndResolvingUrls() throws ScrapeException {
        fetcher.html(SEED, "<html><body><div class=\"event\">"
            + "<h3>  Summer   Concert </h3>"
            + "<time class=\"start\" datetime=\"2025-07-04T20:00:00-04:00\">July 4th, 8pm</time>"
            + "<time class=\"end\">Late</time>"
            + "<span class=\"venue\">Riverside Park</span>"
            + "<p class=\"summary\">Open air.</p>"
            + "<a class=\"details\" href=\"/events/summer-concert\">Details</a>"
            + "<img src=\"img/concert.jpg\">"
            + "</div></body></html>");

        List<RawEvent> events = crawler.crawl(source(10), CancellationToken.none());

        assertEquals(1, events.size());
        RawEvent event = events.get(0);
        assertEquals("Summer Concert", event.name());
        assertEquals("2025-07-04T20:00:00-04:00", event.startDate());
        assertEquals("Late", event.endDate());
        assertEquals("Riverside Park", event.location());
        assertEquals("Open air.", event.description());
        assertEquals("https://venue.example/events/summer-concert", event.url());
        assertEquals("https://venue.example/img/concert.jpg", event.image());
    }

    @Test
    void testItemsWithoutNameAreDiscarded() throws ScrapeException {
        fetcher.html(SEED, "<html><body>"
            + "<div class=\"event\"><h3>Named</h3></div>"
            + "<div class=\"event\"><h3>   </h3></div>"
            + "<div class=\"event\"><p>no heading</p></div>"
            + "</body></html>");

        List<RawEvent> events = crawler.crawl(source(10), CancellationToken.none());

        assertEquals(1, events.size());
        assertEquals("Named", events.get(0).name());
    }

    @Test
    void testAlreadyCancelledFetchesNothing() throws ScrapeException {
        fetcher.html(SEED, listing(null, "Alpha"));

        List<RawEvent> events = crawler.crawl(source(10), CancellationToken.cancelled());

        assertTrue(events.isEmpty());
        assertTrue(fetcher.getRequested().isEmpty());
    }

    @Test
    void testCancellationMidCrawlIsNotAnError() throws ScrapeException {
        CancellationToken token = new CancellationToken();
        fetcher.html(SEED, listing("/events?page=2", "Alpha"))
            .html(BASE + "/events?page=2", listing(null, "Beta"))
            .onFetch(() -> {
                if (fetcher.getRequested().contains(BASE + "/events?page=2")) {
                    token.cancel();
                }
            });

        List<RawEvent> events = crawler.crawl(source(10), token);

        assertTrue(token.isCancelled());
        assertFalse(names(events).contains("Beta"));
    }

    @Test
    void testFailedFollowUpPageKeepsEarlierResults() throws ScrapeException {
        fetcher.html(SEED, listing("/events?page=2", "Alpha"))
            .status(BASE + "/events?page=2", 500);

        List<RawEvent> events = crawler.crawl(source(10), CancellationToken.none());

        assertEquals(Set.of("Alpha"), names(events));
    }

    @Test
    void testSeedFetchFailureIsAnError() {
        fetcher.failing(SEED);

        assertThrows(FetchException.class, () -> crawler.crawl(source(10), CancellationToken.none()));
    }

    @Test
    void testUnreachableRobotsIsFatalForTheCrawl() {
        fetcher.failing(BASE + "/robots.txt").html(SEED, listing(null, "Alpha"));

        assertThrows(FetchException.class, () -> crawler.crawl(source(10), CancellationToken.none()));
        assertFalse(fetcher.getRequested().contains(SEED));
    }

    @Test
    void testSeedDisallowedByRobots() {
        fetcher.text(BASE + "/robots.txt", "User-agent: *\nDisallow: /events\n")
            .html(SEED, listing(null, "Alpha"));

        assertThrows(RobotsDisallowedException.class, () -> crawler.crawl(source(10), CancellationToken.none()));
    }

    @Test
    void testMissingEventListSelector() {
        SourceConfig source = source(10).toBuilder().selectors(SelectorConfig.empty()).build();

        assertThrows(ScrapeException.class, () -> crawler.crawl(source, CancellationToken.none()));
    }
}
