package com.eventsync.infrastructure.persistence;

import com.eventsync.domain.model.ScrapeResult;
import com.eventsync.domain.model.ScrapeRun;
import com.eventsync.domain.ports.ScrapeRunTracker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Used when no MongoDB is configured: runs are only logged by the use case.
 */
@Component
@ConditionalOnProperty(name = "scraper.mongo.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpScrapeRunTracker implements ScrapeRunTracker {

    @Override
    public String runStarted(String sourceName, String sourceUrl, int tier) {
        return null;
    }

    @Override
    public void runCompleted(String runId, ScrapeResult result) {
    }

    @Override
    public void runFailed(String runId, Exception error) {
    }

    @Override
    public List<ScrapeRun> recentRuns(int limit) {
        return List.of();
    }
}
