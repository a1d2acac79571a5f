package com.eventsync.infrastructure.scraper.inspect;

import java.util.List;

/**
 * DOM summary of a page, used to find CSS selectors for a tier 1 source.
 */
public record InspectResult(
    String url,
    int statusCode,
    int bodyBytes,
    List<NameCount> topClasses,
    List<NameCount> dataAttributes,
    List<String> eventLinks,
    List<SampleCard> sampleCards
) {

    /** A CSS class or data-* attribute name and how often it occurs. */
    public record NameCount(String name, int count) {}

    /**
     * A likely event container.
     *
     * @param selector e.g. {@code article.event-card}
     * @param html     start of the element's outer HTML
     */
    public record SampleCard(String selector, String html) {}
}
