package com.eventsync.infrastructure.scheduler;

import com.eventsync.application.usecase.ScrapeEventsUseCase;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.ScrapeOptions;
import com.eventsync.domain.model.ScrapeResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the {@code daily} and {@code weekly} sources on their cron schedules.
 * Disabled unless {@code scraper.scheduling.enabled=true}.
 *
 * Default: daily sources at 03:00 UTC, weekly sources on Monday at 04:00 UTC.
 */
@Component
@ConditionalOnProperty(name = "scraper.scheduling.enabled", havingValue = "true")
public class ScrapeScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ScrapeScheduler.class);

    private final ScrapeEventsUseCase scrapeEventsUseCase;
    private final ScrapeOptions baseOptions;
    private final CancellationToken shutdownToken = new CancellationToken();
    private final AtomicBoolean running = new AtomicBoolean();

    public ScrapeScheduler(
            ScrapeEventsUseCase scrapeEventsUseCase,
            @Value("${scraper.sources-dir:configs/sources}") String sourcesDir,
            @Value("${scraper.scheduling.dry-run:false}") boolean dryRun) {
        this.scrapeEventsUseCase = scrapeEventsUseCase;
        this.baseOptions = new ScrapeOptions(dryRun, 0, sourcesDir, null);
    }

    @Scheduled(cron = "${scraper.scheduling.daily-cron:0 0 3 * * *}", zone = "UTC")
    public void scrapeDaily() {
        runSchedule("daily");
    }

    @Scheduled(cron = "${scraper.scheduling.weekly-cron:0 0 4 * * MON}", zone = "UTC")
    public void scrapeWeekly() {
        runSchedule("weekly");
    }

    void runSchedule(String schedule) {
        if (!running.compareAndSet(false, true)) {
            logger.warn("Skipping {} scrape: previous scheduled run still in progress", schedule);
            return;
        }
        logger.info("Scheduled {} scrape triggered", schedule);
        try {
            List<ScrapeResult> results = scrapeEventsUseCase.scrapeAll(baseOptions.withSchedule(schedule), shutdownToken);
            long failed = results.stream().filter(ScrapeResult::isFailed).count();
            logger.info("Scheduled {} scrape done: {} sources, {} failed", schedule, results.size(), failed);
        } catch (Exception e) {
            logger.error("Scheduled {} scrape failed: {}", schedule, e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }

    @PreDestroy
    public void shutdown() {
        shutdownToken.cancel();
    }
}
