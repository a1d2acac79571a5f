package com.eventsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of scraping one source. Filled in step by step while the run progresses.
 *
 * <p>A non-null {@link #getError()} with zero submitted events means the source
 * failed completely. Records skipped during normalization only show up as
 * {@code eventsFound > eventsSubmitted}.
 */
public class ScrapeResult {

    private String sourceName;
    private String sourceUrl;
    private int tier;

    /** Raw records returned by the extractor, before the per-run limit. */
    private int eventsFound;

    /** Records that survived normalization and were handed to the ingest API. */
    private int eventsSubmitted;

    private int eventsCreated;
    private int eventsDuplicate;
    private int eventsFailed;

    private Exception error;

    private boolean dryRun;

    public ScrapeResult() {
    }

    public ScrapeResult(String sourceName, String sourceUrl, int tier, boolean dryRun) {
        this.sourceName = sourceName;
        this.sourceUrl = sourceUrl;
        this.tier = tier;
        this.dryRun = dryRun;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = sourceUrl;
    }

    public int getTier() {
        return tier;
    }

    public void setTier(int tier) {
        this.tier = tier;
    }

    public int getEventsFound() {
        return eventsFound;
    }

    public void setEventsFound(int eventsFound) {
        this.eventsFound = eventsFound;
    }

    public int getEventsSubmitted() {
        return eventsSubmitted;
    }

    public void setEventsSubmitted(int eventsSubmitted) {
        this.eventsSubmitted = eventsSubmitted;
    }

    public int getEventsCreated() {
        return eventsCreated;
    }

    public void setEventsCreated(int eventsCreated) {
        this.eventsCreated = eventsCreated;
    }

    public int getEventsDuplicate() {
        return eventsDuplicate;
    }

    public void setEventsDuplicate(int eventsDuplicate) {
        this.eventsDuplicate = eventsDuplicate;
    }

    public int getEventsFailed() {
        return eventsFailed;
    }

    public void setEventsFailed(int eventsFailed) {
        this.eventsFailed = eventsFailed;
    }

    @JsonIgnore
    public Exception getError() {
        return error;
    }

    public void setError(Exception error) {
        this.error = error;
    }

    public String getErrorMessage() {
        return error != null ? error.getMessage() : null;
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    @Override
    public String toString() {
        return "ScrapeResult{source='" + sourceName + "', tier=" + tier
            + ", found=" + eventsFound + ", submitted=" + eventsSubmitted
            + ", created=" + eventsCreated + ", duplicate=" + eventsDuplicate
            + ", failed=" + eventsFailed + ", dryRun=" + dryRun
            + (error != null ? ", error='" + error.getMessage() + "'" : "") + "}";
    }
}
