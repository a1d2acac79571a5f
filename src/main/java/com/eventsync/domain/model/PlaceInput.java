package com.eventsync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Event location as accepted by the ingest API.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PlaceInput(
    @JsonProperty("@id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("streetAddress") String streetAddress,
    @JsonProperty("addressLocality") String addressLocality,
    @JsonProperty("addressRegion") String addressRegion,
    @JsonProperty("postalCode") String postalCode,
    @JsonProperty("addressCountry") String addressCountry,
    @JsonProperty("latitude") Double latitude,
    @JsonProperty("longitude") Double longitude
) {

    public static PlaceInput named(String name) {
        return new PlaceInput(null, name, null, null, null, null, null, null, null);
    }
}
