package com.eventsync.infrastructure.scraper.inspect;

import com.eventsync.domain.exception.FetchException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.infrastructure.scraper.FetchedPage;
import com.eventsync.infrastructure.scraper.HttpFetcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fetches a page and summarises its markup: frequent classes and data attributes,
 * links that look like event pages and candidate event containers.
 */
public class PageInspector {

    private static final Logger logger = LoggerFactory.getLogger(PageInspector.class);

    static final Duration FETCH_TIMEOUT = Duration.ofSeconds(20);
    static final int MAX_BODY_BYTES = 10 * 1024 * 1024;

    static final int TOP_CLASSES = 30;
    static final int TOP_DATA_ATTRIBUTES = 15;
    static final int MAX_EVENT_LINKS = 20;
    static final int MAX_SAMPLE_CARDS = 8;
    static final int MAX_SAMPLE_HTML = 300;

    private static final List<String> CARD_TAGS = List.of("article", "li", "div", "section");
    private static final List<String> CARD_WORDS =
        List.of("event", "film", "show", "program", "card", "item", "listing", "performance");

    private final HttpFetcher fetcher;

    public PageInspector(HttpFetcher fetcher) {
        this.fetcher = fetcher;
    }

    public InspectResult inspect(String url) throws FetchException {
        FetchedPage page;
        try {
            page = fetcher.get(url, FETCH_TIMEOUT, MAX_BODY_BYTES, CancellationToken.none());
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException("inspect: fetch " + url + ": " + e.getMessage(), e);
        }
        logger.info("Inspecting {} (status {}, {} bytes)", url, page.statusCode(), page.body().length);

        Document document = Jsoup.parse(page.bodyAsString(), url);
        return new InspectResult(
            url,
            page.statusCode(),
            page.body().length,
            topClasses(document),
            topDataAttributes(document),
            eventLinks(document),
            sampleCards(document)
        );
    }

    static List<InspectResult.NameCount> topClasses(Document document) {
        Map<String, Integer> counts = new HashMap<>();
        for (Element element : document.select("[class]")) {
            for (String cls : element.classNames()) {
                if (!cls.isEmpty()) {
                    counts.merge(cls, 1, Integer::sum);
                }
            }
        }
        return topN(counts, TOP_CLASSES);
    }

    static List<InspectResult.NameCount> topDataAttributes(Document document) {
        Map<String, Integer> counts = new HashMap<>();
        for (Element element : document.getAllElements()) {
            for (Attribute attribute : element.attributes()) {
                if (attribute.getKey().startsWith("data-")) {
                    counts.merge(attribute.getKey(), 1, Integer::sum);
                }
            }
        }
        return topN(counts, TOP_DATA_ATTRIBUTES);
    }

    /**
     * Raw href values containing {@code /event} or {@code /program}, first occurrence order.
     */
    static List<String> eventLinks(Document document) {
        Set<String> links = new LinkedHashSet<>();
        for (Element link : document.select("a[href]")) {
            String href = link.attr("href");
            String lower = href.toLowerCase(Locale.ROOT);
            if (lower.contains("/event") || lower.contains("/program")) {
                links.add(href);
                if (links.size() >= MAX_EVENT_LINKS) {
                    break;
                }
            }
        }
        return new ArrayList<>(links);
    }

    static List<InspectResult.SampleCard> sampleCards(Document document) {
        List<InspectResult.SampleCard> cards = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String tag : CARD_TAGS) {
            for (Element element : document.select(tag + "[class]")) {
                if (cards.size() >= MAX_SAMPLE_CARDS) {
                    return cards;
                }
                String classes = element.className().trim();
                if (classes.isEmpty() || !looksLikeCard(classes)) {
                    continue;
                }
                String selector = tag + "." + classes.split("\\s+")[0];
                if (!seen.add(selector)) {
                    continue;
                }
                String html = element.outerHtml();
                if (html.length() > MAX_SAMPLE_HTML) {
                    html = html.substring(0, MAX_SAMPLE_HTML) + "…";
                }
                cards.add(new InspectResult.SampleCard(selector, html));
            }
        }
        return cards;
    }

    private static boolean looksLikeCard(String classes) {
        String lower = classes.toLowerCase(Locale.ROOT);
        for (String word : CARD_WORDS) {
            if (lower.contains(word)) {
                return true;
            }
        }
        return false;
    }

    // Most frequent first, ties by name
    private static List<InspectResult.NameCount> topN(Map<String, Integer> counts, int n) {
        return counts.entrySet().stream()
            .map(e -> new InspectResult.NameCount(e.getKey(), e.getValue()))
            .sorted(Comparator.comparingInt(InspectResult.NameCount::count).reversed()
                .thenComparing(InspectResult.NameCount::name))
            .limit(n)
            .collect(Collectors.toList());
    }
}
