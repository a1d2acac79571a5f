package com.eventsync.domain.ports;

import com.eventsync.domain.model.ScrapeResult;
import com.eventsync.domain.model.ScrapeRun;

import java.util.List;

/**
 * Port for best-effort run bookkeeping. Callers must not let failures here
 * affect a scrape.
 */
public interface ScrapeRunTracker {

    /**
     * Records the start of a run.
     *
     * @return run id, or null if nothing was recorded
     */
    String runStarted(String sourceName, String sourceUrl, int tier);

    void runCompleted(String runId, ScrapeResult result);

    void runFailed(String runId, Exception error);

    /**
     * Most recent runs first.
     */
    List<ScrapeRun> recentRuns(int limit);
}
