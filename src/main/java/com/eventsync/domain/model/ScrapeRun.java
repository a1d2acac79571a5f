package com.eventsync.domain.model;

import java.time.Instant;

/**
 * Bookkeeping record for one source run, kept by the run tracker.
 */
public class ScrapeRun {

    public enum Status {
        RUNNING, COMPLETED, FAILED
    }

    private String runId;
    private String sourceName;
    private String sourceUrl;
    private int tier;
    private Status status;
    private Instant startedAt;
    private Instant completedAt;
    private int eventsFound;
    private int eventsCreated;
    private int eventsDuplicate;
    private int eventsFailed;

    /** Null unless the run failed. */
    private String errorMessage;

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
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

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public int getEventsFound() {
        return eventsFound;
    }

    public void setEventsFound(int eventsFound) {
        this.eventsFound = eventsFound;
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

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }
}
