package com.eventsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-event error reported by the ingest API, keyed by position in the batch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IngestError(
    @JsonProperty("index") int index,
    @JsonProperty("message") String message
) {
}
