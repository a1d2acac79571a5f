package com.eventsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * CSS selectors used by tier 1 (pattern) scraping.
 * Only {@code eventList} is required, and only when the source is tier 1.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SelectorConfig(
    @JsonProperty("event_list") String eventList,
    @JsonProperty("name") String name,
    @JsonProperty("start_date") String startDate,
    @JsonProperty("end_date") String endDate,
    @JsonProperty("location") String location,
    @JsonProperty("description") String description,
    @JsonProperty("url") String url,
    @JsonProperty("image") String image,
    @JsonProperty("pagination") String pagination
) {

    public static SelectorConfig empty() {
        return new SelectorConfig(null, null, null, null, null, null, null, null, null);
    }
}
