package com.eventsync.infrastructure.scraper.jsonld;

import com.eventsync.domain.exception.FetchException;
import com.eventsync.domain.exception.RobotsDisallowedException;
import com.eventsync.domain.exception.ScrapeException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.ports.StructuredDataExtractor;
import com.eventsync.infrastructure.scraper.FetchedPage;
import com.eventsync.infrastructure.scraper.HttpFetcher;
import com.eventsync.infrastructure.scraper.RobotsPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.List;

/**
 * Tier 0 scraper: reads schema.org events from the JSON-LD blocks of a page.
 *
 * <p>Four container shapes are recognised, at any nesting depth:
 * <ul>
 *   <li>a JSON array of nodes</li>
 *   <li>an object with an {@code @graph} array</li>
 *   <li>an {@code ItemList} whose {@code itemListElement} entries carry an {@code item}</li>
 *   <li>a single {@code Event} / {@code EventSeries} object</li>
 * </ul>
 * Anything else yields no events. A malformed block is skipped; it never aborts the page.
 */
public class JsonLdExtractor implements StructuredDataExtractor {

    private static final Logger logger = LoggerFactory.getLogger(JsonLdExtractor.class);

    static final Duration FETCH_TIMEOUT = Duration.ofSeconds(30);
    static final int MAX_BODY_BYTES = 10 * 1024 * 1024;

    private static final String JSON_LD_SELECTOR = "script[type=application/ld+json]";
    private static final List<String> SCHEMA_PREFIXES = List.of("https://schema.org/", "http://schema.org/");

    private final HttpFetcher fetcher;
    private final RobotsPolicy robotsPolicy;
    private final ObjectMapper objectMapper;

    public JsonLdExtractor(HttpFetcher fetcher, RobotsPolicy robotsPolicy, ObjectMapper objectMapper) {
        this.fetcher = fetcher;
        this.robotsPolicy = robotsPolicy;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<JsonNode> extract(String url, CancellationToken token) throws ScrapeException {
        if (token.isCancelled()) {
            return List.of();
        }
        validateUrl(url);
        checkRobots(url, token);

        FetchedPage page;
        try {
            page = fetcher.get(url, FETCH_TIMEOUT, MAX_BODY_BYTES, token);
        } catch (IOException e) {
            throw new FetchException("fetching " + url + ": " + e.getMessage(), e);
        }
        if (page.statusCode() != 200) {
            throw new FetchException("unexpected status " + page.statusCode() + " fetching " + url, page.statusCode());
        }

        Document document = parseHtml(page);
        List<JsonNode> events = extractFromDocument(document);
        logger.debug("Found {} JSON-LD events on {}", events.size(), url);
        return events;
    }

    /**
     * Extracts events from every JSON-LD block of an already parsed document,
     * keeping block order and node order within each block.
     */
    public List<JsonNode> extractFromDocument(Document document) {
        List<JsonNode> events = new ArrayList<>();
        int blockIndex = 0;
        for (Element script : document.select(JSON_LD_SELECTOR)) {
            blockIndex++;
            String raw = script.data().trim();
            if (raw.isEmpty()) {
                continue;
            }
            try {
                JsonNode block = objectMapper.readTree(raw);
                events.addAll(extractEvents(block));
            } catch (JsonProcessingException e) {
                logger.debug("Skipping malformed JSON-LD block #{} on {}: {}",
                    blockIndex, document.location(), e.getOriginalMessage());
            }
        }
        return events;
    }

    /**
     * Shape dispatch over a single JSON-LD value. Returned nodes are deep copies.
     */
    public static List<JsonNode> extractEvents(JsonNode node) {
        List<JsonNode> events = new ArrayList<>();
        collect(node, events);
        return events;
    }

    private static void collect(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                collect(element, out);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }

        JsonNode graph = node.get("@graph");
        if (graph != null && graph.isArray() && !graph.isEmpty()) {
            collect(graph, out);
            return;
        }

        String type = typeOf(node);
        JsonNode listItems = node.get("itemListElement");
        if ("ItemList".equals(type) && listItems != null && !listItems.isEmpty()) {
            for (JsonNode listItem : listItems) {
                JsonNode item = listItem.get("item");
                if (item != null && !item.isNull()) {
                    collect(item, out);
                }
            }
            return;
        }

        if (isEventType(type)) {
            out.add(node.deepCopy());
        }
    }

    /**
     * The {@code @type} of a node, accepting a string or a one-element array,
     * with any schema.org namespace prefix removed. Empty string if absent.
     */
    public static String typeOf(JsonNode node) {
        JsonNode type = node.get("@type");
        if (type == null) {
            return "";
        }
        if (type.isArray()) {
            type = type.isEmpty() ? null : type.get(0);
        }
        if (type == null || !type.isTextual()) {
            return "";
        }
        return stripSchemaPrefix(type.asText());
    }

    public static String stripSchemaPrefix(String type) {
        for (String prefix : SCHEMA_PREFIXES) {
            if (type.startsWith(prefix)) {
                return type.substring(prefix.length());
            }
        }
        return type;
    }

    static boolean isEventType(String type) {
        return "Event".equals(type) || "EventSeries".equals(type);
    }

    private void checkRobots(String url, CancellationToken token) throws RobotsDisallowedException {
        BaseRobotRules rules;
        try {
            rules = robotsPolicy.fetchRules(url, token);
        } catch (IOException e) {
            logger.warn("robots.txt check failed for {}, proceeding as allowed: {}", url, e.getMessage());
            return;
        }
        if (!rules.isAllowed(url)) {
            throw new RobotsDisallowedException(url);
        }
    }

    private static void validateUrl(String url) throws FetchException {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new FetchException("invalid URL " + url + ": scheme must be http or https", -1);
            }
            if (uri.getHost() == null) {
                throw new FetchException("invalid URL " + url + ": missing host", -1);
            }
        } catch (URISyntaxException e) {
            throw new FetchException("invalid URL " + url + ": " + e.getMessage(), e);
        }
    }

    private static Document parseHtml(FetchedPage page) throws FetchException {
        String charset = page.declaredCharset() != null ? page.declaredCharset().name() : null;
        try {
            return Jsoup.parse(new ByteArrayInputStream(page.body()), charset, page.url());
        } catch (IOException e) {
            throw new FetchException("parsing HTML from " + page.url() + ": " + e.getMessage(), e);
        }
    }
}
