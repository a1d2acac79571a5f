package com.eventsync.domain.model;

/**
 * Text fields extracted from one matched item by tier 1 scraping.
 * Nothing is validated here; the normalizer decides what is usable.
 */
public record RawEvent(
    String name,
    String startDate,
    String endDate,
    String location,
    String description,
    String url,
    String image
) {
}
