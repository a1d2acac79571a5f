package com.eventsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed response of a batch submission (or the sum over several chunks).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IngestResult(
    @JsonProperty("batch_id") String batchId,
    @JsonProperty("events_created") int eventsCreated,
    @JsonProperty("events_duplicate") int eventsDuplicate,
    @JsonProperty("events_failed") int eventsFailed,
    @JsonProperty("errors") List<IngestError> errors
) {

    public static final String DRY_RUN_BATCH_ID = "dry-run";

    public IngestResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static IngestResult empty() {
        return new IngestResult(null, 0, 0, 0, List.of());
    }

    public static IngestResult dryRun(int eventCount) {
        return new IngestResult(DRY_RUN_BATCH_ID, eventCount, 0, 0, List.of());
    }

    /**
     * Adds the counts of {@code next} to this result. Error indexes of {@code next}
     * are shifted by {@code offset} so they stay relative to the whole submission.
     * The batch id of {@code next} wins when present.
     */
    public IngestResult plus(IngestResult next, int offset) {
        List<IngestError> merged = new ArrayList<>(errors);
        for (IngestError error : next.errors()) {
            merged.add(new IngestError(error.index() + offset, error.message()));
        }
        String id = next.batchId() != null && !next.batchId().isEmpty() ? next.batchId() : batchId;
        return new IngestResult(
            id,
            eventsCreated + next.eventsCreated(),
            eventsDuplicate + next.eventsDuplicate(),
            eventsFailed + next.eventsFailed(),
            merged
        );
    }
}
