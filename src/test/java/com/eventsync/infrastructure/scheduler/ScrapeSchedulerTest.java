package com.eventsync.infrastructure.scheduler;

import com.eventsync.application.usecase.ScrapeEventsUseCase;
import com.eventsync.domain.exception.SourceConfigException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.ScrapeOptions;
import com.eventsync.domain.model.ScrapeResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScrapeScheduler.
 */
class ScrapeSchedulerTest {

    @Test
    void testRunsWithScheduleFilter() {
        RecordingUseCase useCase = new RecordingUseCase();
        ScrapeScheduler scheduler = new ScrapeScheduler(useCase, "configs/sources", true);

        scheduler.scrapeDaily();
        scheduler.scrapeWeekly();

        assertEquals(2, useCase.calls.size());
        assertEquals("daily", useCase.calls.get(0).schedule());
        assertEquals("weekly", useCase.calls.get(1).schedule());
        assertTrue(useCase.calls.get(0).dryRun());
    }

    @Test
    void testOverlappingRunIsSkipped() {
        RecordingUseCase useCase = new RecordingUseCase();
        ScrapeScheduler scheduler = new ScrapeScheduler(useCase, "configs/sources", false);
        useCase.during = () -> scheduler.runSchedule("weekly");

        scheduler.runSchedule("daily");

        assertEquals(1, useCase.calls.size());
        assertEquals("daily", useCase.calls.get(0).schedule());
    }

    @Test
    void testLoadFailureDoesNotEscape() {
        RecordingUseCase useCase = new RecordingUseCase();
        useCase.failure = new SourceConfigException("invalid source configs");
        ScrapeScheduler scheduler = new ScrapeScheduler(useCase, "configs/sources", false);

        assertDoesNotThrow(scheduler::scrapeDaily);
        // the guard is released after a failure
        useCase.failure = null;
        scheduler.scrapeDaily();
        assertEquals(2, useCase.calls.size());
    }

    @Test
    void testShutdownCancelsToken() {
        RecordingUseCase useCase = new RecordingUseCase();
        ScrapeScheduler scheduler = new ScrapeScheduler(useCase, "configs/sources", false);

        scheduler.shutdown();
        scheduler.scrapeDaily();

        assertTrue(useCase.lastToken.isCancelled());
    }

    private static class RecordingUseCase extends ScrapeEventsUseCase {
        private final List<ScrapeOptions> calls = new ArrayList<>();
        private Runnable during = () -> { };
        private SourceConfigException failure;
        private CancellationToken lastToken;

        RecordingUseCase() {
            super(null, null, null, null, null, null, null);
        }

        @Override
        public List<ScrapeResult> scrapeAll(ScrapeOptions options, CancellationToken token)
                throws SourceConfigException {
            calls.add(options);
            lastToken = token;
            during.run();
            if (failure != null) {
                throw failure;
            }
            return List.of();
        }
    }
}
