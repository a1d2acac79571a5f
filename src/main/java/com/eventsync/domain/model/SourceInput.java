package com.eventsync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Attribution block sent with every event.
 *
 * @param url     the configured source URL, not the event URL
 * @param eventId stable per-event identifier the API deduplicates on
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SourceInput(
    @JsonProperty("url") String url,
    @JsonProperty("eventId") String eventId,
    @JsonProperty("name") String name,
    @JsonProperty("license") String license
) {
}
