package com.eventsync.infrastructure.scraper.selector;

import com.eventsync.domain.model.RawEvent;
import com.eventsync.domain.model.SelectorConfig;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the sub-selectors of a {@link SelectorConfig} to one matched item.
 */
final class SelectorExtraction {

    private static final Logger logger = LoggerFactory.getLogger(SelectorExtraction.class);

    private SelectorExtraction() {
    }

    static RawEvent extract(Element item, SelectorConfig selectors) {
        return new RawEvent(
            text(item, selectors.name()),
            date(item, selectors.startDate()),
            date(item, selectors.endDate()),
            text(item, selectors.location()),
            text(item, selectors.description()),
            absoluteUrl(item, selectors.url(), "href"),
            absoluteUrl(item, selectors.image(), "src")
        );
    }

    /**
     * Text of all matches, trimmed. Empty when the selector is unset or matches nothing.
     */
    static String text(Element item, String selector) {
        Elements matches = select(item, selector);
        return matches.isEmpty() ? "" : matches.text().trim();
    }

    /**
     * Prefers the machine readable {@code datetime} attribute (HTML5 {@code <time>})
     * over the visible text.
     */
    static String date(Element item, String selector) {
        Elements matches = select(item, selector);
        for (Element match : matches) {
            String datetime = match.attr("datetime").trim();
            if (!datetime.isEmpty()) {
                return datetime;
            }
        }
        return matches.isEmpty() ? "" : matches.text().trim();
    }

    /**
     * First {@code attribute} value among the matches, resolved against the page URL.
     */
    static String absoluteUrl(Element item, String selector, String attribute) {
        for (Element match : select(item, selector)) {
            if (match.hasAttr(attribute) && !match.attr(attribute).isBlank()) {
                String resolved = match.absUrl(attribute);
                return resolved.isEmpty() ? match.attr(attribute).trim() : resolved;
            }
        }
        return "";
    }

    private static Elements select(Element item, String selector) {
        if (selector == null || selector.isBlank()) {
            return new Elements();
        }
        try {
            return item.select(selector);
        } catch (Selector.SelectorParseException e) {
            logger.debug("Invalid selector '{}': {}", selector, e.getMessage());
            return new Elements();
        }
    }
}
