package com.eventsync.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Canonical event record submitted to the ingest API.
 * Dates are kept as the strings found on the page; the API validates them.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record EventInput(
    @JsonProperty("@type") String type,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("startDate") String startDate,
    @JsonProperty("endDate") String endDate,
    @JsonProperty("doorTime") String doorTime,
    @JsonProperty("location") PlaceInput location,
    @JsonProperty("organizer") OrganizationInput organizer,
    @JsonProperty("image") String image,
    @JsonProperty("url") String url,
    @JsonProperty("offers") OfferInput offers,
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("inLanguage") List<String> inLanguage,
    @JsonProperty("isAccessibleForFree") Boolean isAccessibleForFree,
    @JsonProperty("sameAs") List<String> sameAs,
    @JsonProperty("license") String license,
    @JsonProperty("source") SourceInput source
) {

    public EventInput {
        keywords = keywords != null ? List.copyOf(keywords) : null;
        inLanguage = inLanguage != null ? List.copyOf(inLanguage) : null;
        sameAs = sameAs != null ? List.copyOf(sameAs) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String type = "Event";
        private String name;
        private String description;
        private String startDate;
        private String endDate;
        private String doorTime;
        private PlaceInput location;
        private OrganizationInput organizer;
        private String image;
        private String url;
        private OfferInput offers;
        private List<String> keywords;
        private List<String> inLanguage;
        private Boolean isAccessibleForFree;
        private List<String> sameAs;
        private String license;
        private SourceInput source;

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder startDate(String startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(String endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder doorTime(String doorTime) {
            this.doorTime = doorTime;
            return this;
        }

        public Builder location(PlaceInput location) {
            this.location = location;
            return this;
        }

        public Builder organizer(OrganizationInput organizer) {
            this.organizer = organizer;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder offers(OfferInput offers) {
            this.offers = offers;
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords = keywords;
            return this;
        }

        public Builder inLanguage(List<String> inLanguage) {
            this.inLanguage = inLanguage;
            return this;
        }

        public Builder isAccessibleForFree(Boolean isAccessibleForFree) {
            this.isAccessibleForFree = isAccessibleForFree;
            return this;
        }

        public Builder sameAs(List<String> sameAs) {
            this.sameAs = sameAs;
            return this;
        }

        public Builder license(String license) {
            this.license = license;
            return this;
        }

        public Builder source(SourceInput source) {
            this.source = source;
            return this;
        }

        public EventInput build() {
            return new EventInput(type, name, description, startDate, endDate, doorTime, location,
                organizer, image, url, offers, keywords, inLanguage, isAccessibleForFree, sameAs,
                license, source);
        }
    }
}
