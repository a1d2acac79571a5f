package com.eventsync.infrastructure.scraper.inspect;

import com.eventsync.domain.exception.FetchException;
import com.eventsync.infrastructure.scraper.FakeHttpFetcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PageInspector.
 */
class PageInspectorTest {

    private static final String PAGE = "<html><body>"
        + "<ul class=\"listing\">"
        + "<li class=\"event-card featured\" data-id=\"1\"><a href=\"/events/one\">One</a></li>"
        + "<li class=\"event-card\" data-id=\"2\"><a href=\"/events/two\">Two</a></li>"
        + "<li class=\"event-card\" data-id=\"3\" data-kind=\"gig\"><a href=\"/events/one\">One again</a></li>"
        + "</ul>"
        + "<div class=\"footer\"><a href=\"/about\">About</a><a href=\"/Program/2025\">Programme</a></div>"
        + "</body></html>";

    private static Document parse(String html) {
        return Jsoup.parse(html, "https://venue.example/");
    }

    @Test
    void testTopClassesSortedByCount() {
        List<InspectResult.NameCount> classes = PageInspector.topClasses(parse(PAGE));

        assertEquals(new InspectResult.NameCount("event-card", 3), classes.get(0));
        // ties ordered by name
        assertEquals(List.of("featured", "footer", "listing"),
            classes.subList(1, 4).stream().map(InspectResult.NameCount::name).toList());
    }

    @Test
    void testTopDataAttributes() {
        List<InspectResult.NameCount> attributes = PageInspector.topDataAttributes(parse(PAGE));

        assertEquals(List.of(new InspectResult.NameCount("data-id", 3), new InspectResult.NameCount("data-kind", 1)),
            attributes);
    }

    @Test
    void testEventLinksDeduplicatedInOrder() {
        List<String> links = PageInspector.eventLinks(parse(PAGE));

        assertEquals(List.of("/events/one", "/events/two", "/Program/2025"), links);
    }

    @Test
    void testEventLinksCapped() {
        StringBuilder html = new StringBuilder("<html><body>");
        for (int i = 0; i < 50; i++) {
            html.append("<a href=\"/event/").append(i).append("\">e</a>");
        }
        html.append("</body></html>");

        assertEquals(PageInspector.MAX_EVENT_LINKS, PageInspector.eventLinks(parse(html.toString())).size());
    }

    @Test
    void testSampleCardsUseFirstClassOnce() {
        List<InspectResult.SampleCard> cards = PageInspector.sampleCards(parse(PAGE));

        List<String> selectors = cards.stream().map(InspectResult.SampleCard::selector).toList();
        assertEquals(List.of("li.event-card"), selectors);
        assertTrue(cards.get(0).html().startsWith("<li class=\"event-card featured\""));
    }

    @Test
    void testSampleCardHtmlTruncated() {
        String longText = "x".repeat(1000);
        Document document = parse("<div class=\"show\">" + longText + "</div>");

        List<InspectResult.SampleCard> cards = PageInspector.sampleCards(document);

        assertEquals(1, cards.size());
        String html = cards.get(0).html();
        assertEquals(PageInspector.MAX_SAMPLE_HTML + 1, html.length());
        assertTrue(html.endsWith("…"));
    }

    @Test
    void testInspectFetchesAndSummarises() throws FetchException {
        FakeHttpFetcher fetcher = new FakeHttpFetcher().html("https://venue.example/", PAGE);

        InspectResult result = new PageInspector(fetcher).inspect("https://venue.example/");

        assertEquals(200, result.statusCode());
        assertTrue(result.bodyBytes() > 0);
        assertEquals("event-card", result.topClasses().get(0).name());
        assertEquals(3, result.eventLinks().size());
    }

    @Test
    void testInspectReportsNonSuccessStatus() throws FetchException {
        FakeHttpFetcher fetcher = new FakeHttpFetcher().status("https://venue.example/gone", 404);

        InspectResult result = new PageInspector(fetcher).inspect("https://venue.example/gone");

        assertEquals(404, result.statusCode());
        assertTrue(result.eventLinks().isEmpty());
    }

    @Test
    void testInspectNetworkError() {
        FakeHttpFetcher fetcher = new FakeHttpFetcher().failing("https://venue.example/");

        assertThrows(FetchException.class, () -> new PageInspector(fetcher).inspect("https://venue.example/"));
    }
}
