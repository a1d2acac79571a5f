package com.eventsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * One scrape target, loaded from a YAML file or from the source registry.
 * Immutable; a fresh instance is built on every orchestration run.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonDeserialize(builder = SourceConfig.Builder.class)
public final class SourceConfig {

    public static final int TIER_STRUCTURED = 0;
    public static final int TIER_SELECTORS = 1;

    public static final int DEFAULT_TRUST_LEVEL = 5;
    public static final int DEFAULT_MAX_PAGES = 10;
    public static final String DEFAULT_SCHEDULE = "manual";

    /** Unique display and dedup key. */
    private final String name;

    private final String url;

    /** 0 = JSON-LD, 1 = CSS selectors. */
    private final int tier;

    /** daily | weekly | manual. */
    private final String schedule;

    /** 1 (low) .. 10 (high). */
    private final int trustLevel;

    private final String license;

    private final boolean enabled;

    /** Free-form hint describing what event detail URLs look like on the site. */
    private final String eventUrlPattern;

    private final int maxPages;

    private final String notes;

    private final SelectorConfig selectors;

    private SourceConfig(Builder builder) {
        this.name = builder.name;
        this.url = builder.url;
        this.tier = builder.tier;
        this.schedule = builder.schedule;
        this.trustLevel = builder.trustLevel;
        this.license = builder.license;
        this.enabled = builder.enabled;
        this.eventUrlPattern = builder.eventUrlPattern;
        this.maxPages = builder.maxPages;
        this.notes = builder.notes;
        this.selectors = builder.selectors;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .name(name)
            .url(url)
            .tier(tier)
            .schedule(schedule)
            .trustLevel(trustLevel)
            .license(license)
            .enabled(enabled)
            .eventUrlPattern(eventUrlPattern)
            .maxPages(maxPages)
            .notes(notes)
            .selectors(selectors);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("url")
    public String getUrl() {
        return url;
    }

    @JsonProperty("tier")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public int getTier() {
        return tier;
    }

    @JsonProperty("schedule")
    public String getSchedule() {
        return schedule;
    }

    @JsonProperty("trust_level")
    public int getTrustLevel() {
        return trustLevel;
    }

    @JsonProperty("license")
    public String getLicense() {
        return license;
    }

    @JsonProperty("enabled")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public boolean isEnabled() {
        return enabled;
    }

    @JsonProperty("event_url_pattern")
    public String getEventUrlPattern() {
        return eventUrlPattern;
    }

    @JsonProperty("max_pages")
    public int getMaxPages() {
        return maxPages;
    }

    @JsonProperty("notes")
    public String getNotes() {
        return notes;
    }

    @JsonProperty("selectors")
    public SelectorConfig getSelectors() {
        return selectors;
    }

    /**
     * Selectors, never null.
     */
    public SelectorConfig selectorsOrEmpty() {
        return selectors != null ? selectors : SelectorConfig.empty();
    }

    @Override
    public String toString() {
        return "SourceConfig{name='" + name + "', url='" + url + "', tier=" + tier + ", enabled=" + enabled + "}";
    }

    /**
     * Builder pre-populated with the source file defaults, so that keys missing
     * from a YAML document keep their default value.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private String name;
        private String url;
        private int tier = TIER_STRUCTURED;
        private String schedule = DEFAULT_SCHEDULE;
        private int trustLevel = DEFAULT_TRUST_LEVEL;
        private String license;
        private boolean enabled = true;
        private String eventUrlPattern;
        private int maxPages = DEFAULT_MAX_PAGES;
        private String notes;
        private SelectorConfig selectors;

        @JsonProperty("name")
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        @JsonProperty("url")
        public Builder url(String url) {
            this.url = url;
            return this;
        }

        @JsonProperty("tier")
        public Builder tier(int tier) {
            this.tier = tier;
            return this;
        }

        @JsonProperty("schedule")
        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        @JsonProperty("trust_level")
        public Builder trustLevel(int trustLevel) {
            this.trustLevel = trustLevel;
            return this;
        }

        @JsonProperty("license")
        public Builder license(String license) {
            this.license = license;
            return this;
        }

        @JsonProperty("enabled")
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        @JsonProperty("event_url_pattern")
        public Builder eventUrlPattern(String eventUrlPattern) {
            this.eventUrlPattern = eventUrlPattern;
            return this;
        }

        @JsonProperty("max_pages")
        public Builder maxPages(int maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        @JsonProperty("notes")
        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        @JsonProperty("selectors")
        public Builder selectors(SelectorConfig selectors) {
            this.selectors = selectors;
            return this;
        }

        public SourceConfig build() {
            // An explicit 0 in a source file means "use the default".
            if (trustLevel == 0) {
                trustLevel = DEFAULT_TRUST_LEVEL;
            }
            if (maxPages == 0) {
                maxPages = DEFAULT_MAX_PAGES;
            }
            return new SourceConfig(this);
        }
    }
}
