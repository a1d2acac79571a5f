package com.eventsync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Ticket offer. Price stays a string, the API validates it.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OfferInput(
    @JsonProperty("url") String url,
    @JsonProperty("price") String price,
    @JsonProperty("priceCurrency") String priceCurrency
) {
}
