package com.eventsync.infrastructure.rest;

import com.eventsync.application.usecase.ScrapeEventsUseCase;
import com.eventsync.application.usecase.SyncSourcesUseCase;
import com.eventsync.domain.exception.FetchException;
import com.eventsync.domain.exception.ScrapeException;
import com.eventsync.domain.exception.SourceConfigException;
import com.eventsync.domain.exception.SourceNotFoundException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.ScrapeOptions;
import com.eventsync.domain.model.ScrapeResult;
import com.eventsync.domain.model.ScrapeRun;
import com.eventsync.domain.model.SourceConfig;
import com.eventsync.domain.ports.ScrapeRunTracker;
import com.eventsync.infrastructure.scraper.inspect.InspectResult;
import com.eventsync.infrastructure.scraper.inspect.PageInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for scrape operations.
 */
@RestController
@RequestMapping("/scrape")
public class ScrapeController {

    private static final Logger logger = LoggerFactory.getLogger(ScrapeController.class);

    private final ScrapeEventsUseCase scrapeEventsUseCase;
    private final SyncSourcesUseCase syncSourcesUseCase;
    private final PageInspector pageInspector;
    private final ScrapeRunTracker runTracker;
    private final String sourcesDir;

    public ScrapeController(
            ScrapeEventsUseCase scrapeEventsUseCase,
            SyncSourcesUseCase syncSourcesUseCase,
            PageInspector pageInspector,
            ScrapeRunTracker runTracker,
            @Value("${scraper.sources-dir:configs/sources}") String sourcesDir) {
        this.scrapeEventsUseCase = scrapeEventsUseCase;
        this.syncSourcesUseCase = syncSourcesUseCase;
        this.pageInspector = pageInspector;
        this.runTracker = runTracker;
        this.sourcesDir = sourcesDir;
    }

    /**
     * Scrapes the JSON-LD events of a single page.
     *
     * POST /scrape/url?url=https://example.org/events&dryRun=true
     */
    @PostMapping("/url")
    public ResponseEntity<ScrapeResult> scrapeUrl(
            @RequestParam String url,
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestParam(defaultValue = "0") int limit) {
        logger.info("Received request to scrape URL {}", url);
        ScrapeResult result = scrapeEventsUseCase.scrapeUrl(url, options(dryRun, limit, null), new CancellationToken());
        return ResponseEntity.ok(result);
    }

    /**
     * POST /scrape/sources/{name}
     */
    @PostMapping("/sources/{name}")
    public ResponseEntity<?> scrapeSource(
            @PathVariable String name,
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestParam(defaultValue = "0") int limit) {
        logger.info("Received request to scrape source {}", name);
        try {
            return ResponseEntity.ok(
                scrapeEventsUseCase.scrapeSource(name, options(dryRun, limit, null), new CancellationToken()));
        } catch (SourceNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, e);
        } catch (ScrapeException e) {
            return error(HttpStatus.BAD_REQUEST, e);
        }
    }

    /**
     * Scrapes all enabled sources, optionally only those with the given schedule.
     *
     * POST /scrape/all?schedule=daily
     */
    @PostMapping("/all")
    public ResponseEntity<?> scrapeAll(
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestParam(defaultValue = "0") int limit,
            @RequestParam(required = false) String schedule) {
        logger.info("Received request to scrape all sources");
        try {
            List<ScrapeResult> results =
                scrapeEventsUseCase.scrapeAll(options(dryRun, limit, schedule), new CancellationToken());
            return ResponseEntity.ok(results);
        } catch (SourceConfigException e) {
            return error(HttpStatus.BAD_REQUEST, e);
        }
    }

    @GetMapping("/sources")
    public ResponseEntity<?> listSources() {
        try {
            List<SourceConfig> sources = scrapeEventsUseCase.loadSources(options(false, 0, null));
            return ResponseEntity.ok(sources);
        } catch (SourceConfigException e) {
            return error(HttpStatus.BAD_REQUEST, e);
        }
    }

    @PostMapping("/sources/sync")
    public ResponseEntity<?> syncSources(@RequestParam(required = false) String dir) {
        try {
            return ResponseEntity.ok(syncSourcesUseCase.sync(Paths.get(dir != null ? dir : sourcesDir)));
        } catch (SourceConfigException e) {
            return error(HttpStatus.BAD_REQUEST, e);
        }
    }

    @PostMapping("/sources/export")
    public ResponseEntity<List<String>> exportSources(@RequestParam(required = false) String dir) {
        List<Path> written = syncSourcesUseCase.export(Paths.get(dir != null ? dir : sourcesDir));
        return ResponseEntity.ok(written.stream().map(Path::toString).collect(Collectors.toList()));
    }

    /**
     * GET /scrape/inspect?url=https://example.org/events
     */
    @GetMapping("/inspect")
    public ResponseEntity<?> inspect(@RequestParam String url) {
        try {
            InspectResult result = pageInspector.inspect(url);
            return ResponseEntity.ok(result);
        } catch (FetchException e) {
            return error(HttpStatus.BAD_GATEWAY, e);
        }
    }

    @GetMapping("/runs")
    public ResponseEntity<List<ScrapeRun>> recentRuns(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(runTracker.recentRuns(Math.max(1, limit)));
    }

    private ScrapeOptions options(boolean dryRun, int limit, String schedule) {
        return new ScrapeOptions(dryRun, limit, sourcesDir, schedule);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, Exception e) {
        logger.warn("Request failed with {}: {}", status.value(), e.getMessage());
        if (e instanceof SourceConfigException && !((SourceConfigException) e).getProblems().isEmpty()) {
            return ResponseEntity.status(status)
                .body(Map.of("error", e.getMessage(), "problems", ((SourceConfigException) e).getProblems()));
        }
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
