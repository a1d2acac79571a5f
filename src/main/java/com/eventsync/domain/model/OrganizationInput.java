package com.eventsync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Event organizer as accepted by the ingest API.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OrganizationInput(
    @JsonProperty("@id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("url") String url,
    @JsonProperty("email") String email,
    @JsonProperty("telephone") String telephone
) {
}
