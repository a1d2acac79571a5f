package com.eventsync.application.usecase;

import com.eventsync.domain.exception.FetchException;
import com.eventsync.domain.exception.NormalizationException;
import com.eventsync.domain.exception.ScrapeCancelledException;
import com.eventsync.domain.exception.ScrapeException;
import com.eventsync.domain.exception.SourceConfigException;
import com.eventsync.domain.exception.SourceNotFoundException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.EventInput;
import com.eventsync.domain.model.IngestResult;
import com.eventsync.domain.model.RawEvent;
import com.eventsync.domain.model.ScrapeOptions;
import com.eventsync.domain.model.ScrapeResult;
import com.eventsync.domain.model.SourceConfig;
import com.eventsync.domain.ports.IngestGateway;
import com.eventsync.domain.ports.PatternCrawler;
import com.eventsync.domain.ports.ScrapeRunTracker;
import com.eventsync.domain.ports.SourceRegistry;
import com.eventsync.domain.ports.StructuredDataExtractor;
import com.eventsync.infrastructure.normalization.EventNormalizer;
import com.eventsync.infrastructure.source.SourceConfigValidator;
import com.eventsync.infrastructure.source.YamlSourceConfigLoader;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Use case for scraping sources and submitting their events to the ingest API.
 *
 * Every source run goes through fetch, normalize, submit and record. A failure
 * while fetching or submitting ends the run with the error attached to its
 * {@link ScrapeResult}; records that fail normalization are skipped and counted.
 */
@Service
public class ScrapeEventsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(ScrapeEventsUseCase.class);

    private final StructuredDataExtractor structuredDataExtractor;
    private final PatternCrawler patternCrawler;
    private final EventNormalizer normalizer;
    private final IngestGateway ingestGateway;
    private final SourceRegistry sourceRegistry;
    private final ScrapeRunTracker runTracker;
    private final YamlSourceConfigLoader sourceLoader;

    public ScrapeEventsUseCase(
            StructuredDataExtractor structuredDataExtractor,
            PatternCrawler patternCrawler,
            EventNormalizer normalizer,
            IngestGateway ingestGateway,
            SourceRegistry sourceRegistry,
            ScrapeRunTracker runTracker,
            YamlSourceConfigLoader sourceLoader) {
        this.structuredDataExtractor = structuredDataExtractor;
        this.patternCrawler = patternCrawler;
        this.normalizer = normalizer;
        this.ingestGateway = ingestGateway;
        this.sourceRegistry = sourceRegistry;
        this.runTracker = runTracker;
        this.sourceLoader = sourceLoader;
    }

    /**
     * Ad-hoc tier 0 scrape of a single page. The source is named after the URL host.
     * Never throws: an unusable URL is reported through {@link ScrapeResult#getError()}.
     */
    public ScrapeResult scrapeUrl(String url, ScrapeOptions options, CancellationToken token) {
        String host;
        try {
            host = new URI(url.trim()).getHost();
        } catch (URISyntaxException e) {
            host = null;
        }
        if (host == null || host.isEmpty()) {
            ScrapeResult result = new ScrapeResult(null, url, SourceConfig.TIER_STRUCTURED, options.dryRun());
            result.setError(new FetchException("invalid URL: " + url, -1));
            return result;
        }

        SourceConfig source = SourceConfig.builder()
            .name(host)
            .url(url.trim())
            .tier(SourceConfig.TIER_STRUCTURED)
            .trustLevel(SourceConfig.DEFAULT_TRUST_LEVEL)
            .build();
        return scrape(source, options, token);
    }

    /**
     * Scrapes one configured source, looked up by name ignoring case.
     *
     * @throws SourceConfigException  if the sources cannot be loaded
     * @throws SourceNotFoundException if no source has that name
     * @throws ScrapeException         if the source is disabled
     */
    public ScrapeResult scrapeSource(String sourceName, ScrapeOptions options, CancellationToken token)
            throws ScrapeException {
        List<SourceConfig> sources = loadSources(options);

        SourceConfig found = null;
        for (SourceConfig source : sources) {
            if (source.getName().equalsIgnoreCase(sourceName)) {
                found = source;
                break;
            }
        }
        if (found == null) {
            throw new SourceNotFoundException(sourceName);
        }
        if (!found.isEnabled()) {
            throw new ScrapeException("source is disabled: " + sourceName);
        }
        return scrape(found, options, token);
    }

    /**
     * Scrapes every enabled source one after the other. A failing source does not
     * stop the others; cancellation stops before the next source.
     *
     * @throws SourceConfigException if the sources cannot be loaded
     */
    public List<ScrapeResult> scrapeAll(ScrapeOptions options, CancellationToken token) throws SourceConfigException {
        List<SourceConfig> sources = loadSources(options);
        logger.info("Starting scrape of {} sources (dryRun={}, limit={}, schedule={})",
            sources.size(), options.dryRun(), options.limit(), options.schedule());

        List<ScrapeResult> results = new ArrayList<>();
        for (SourceConfig source : sources) {
            if (token.isCancelled()) {
                logger.info("Scrape cancelled after {} of {} sources", results.size(), sources.size());
                break;
            }
            // Sources from YAML files are not pre-filtered
            if (!source.isEnabled()) {
                logger.debug("Skipping disabled source {}", source.getName());
                continue;
            }
            if (options.schedule() != null && !options.schedule().equalsIgnoreCase(source.getSchedule())) {
                continue;
            }
            results.add(scrape(source, options, token));
        }

        long failed = results.stream().filter(ScrapeResult::isFailed).count();
        logger.info("Scrape finished: {} sources, {} failed", results.size(), failed);
        return results;
    }

    /**
     * Registry first (enabled sources only), YAML directory when the registry
     * fails or has nothing usable.
     */
    public List<SourceConfig> loadSources(ScrapeOptions options) throws SourceConfigException {
        List<SourceConfig> fromRegistry = List.of();
        try {
            fromRegistry = sourceRegistry.listEnabled();
        } catch (RuntimeException e) {
            logger.warn("Source registry unavailable, falling back to {}: {}", options.sourcesDir(), e.getMessage());
        }

        List<SourceConfig> usable = new ArrayList<>();
        for (SourceConfig source : fromRegistry) {
            List<String> problems = SourceConfigValidator.validate(source);
            if (problems.isEmpty()) {
                usable.add(source);
            } else {
                logger.warn("Skipping registry source {}: {}", source.getName(), String.join("; ", problems));
            }
        }
        if (!usable.isEmpty()) {
            return usable;
        }

        return sourceLoader.loadDirectory(Paths.get(options.sourcesDir()));
    }

    ScrapeResult scrape(SourceConfig source, ScrapeOptions options, CancellationToken token) {
        ScrapeResult result = new ScrapeResult(source.getName(), source.getUrl(), source.getTier(), options.dryRun());
        String runId = trackStarted(source);

        logger.info("Scraping {} (tier {}) {}", source.getName(), source.getTier(), source.getUrl());
        try {
            List<EventInput> events = fetchAndNormalize(source, options, token, result);
            if (token.isCancelled()) {
                throw new ScrapeCancelledException("scrape of " + source.getName() + " cancelled");
            }

            result.setEventsSubmitted(events.size());
            if (!events.isEmpty()) {
                IngestResult ingestResult = ingestGateway.submit(events, options.dryRun(), token);
                result.setEventsCreated(ingestResult.eventsCreated());
                result.setEventsDuplicate(ingestResult.eventsDuplicate());
                result.setEventsFailed(ingestResult.eventsFailed());
            }

            trackCompleted(runId, result);
            if (!options.dryRun()) {
                markScraped(source.getName());
            }
            logger.info("Scraped {}: found={} submitted={} created={} duplicate={} failed={}",
                source.getName(), result.getEventsFound(), result.getEventsSubmitted(),
                result.getEventsCreated(), result.getEventsDuplicate(), result.getEventsFailed());
        } catch (ScrapeException e) {
            ScrapeException error = e;
            if (token.isCancelled() && !(e instanceof ScrapeCancelledException)) {
                error = new ScrapeCancelledException("scrape of " + source.getName() + " cancelled", e);
            }
            result.setError(error);
            trackFailed(runId, error);
            logger.error("Scrape of {} failed: {}", source.getName(), error.getMessage());
        }
        return result;
    }

    private List<EventInput> fetchAndNormalize(SourceConfig source, ScrapeOptions options,
                                               CancellationToken token, ScrapeResult result)
            throws ScrapeException {
        switch (source.getTier()) {
            case SourceConfig.TIER_STRUCTURED: {
                List<JsonNode> nodes = structuredDataExtractor.extract(source.getUrl(), token);
                result.setEventsFound(nodes.size());
                List<EventInput> events = new ArrayList<>();
                int skipped = 0;
                for (JsonNode node : limit(nodes, options.limit())) {
                    try {
                        events.add(normalizer.normalizeStructured(node, source));
                    } catch (NormalizationException e) {
                        logger.debug("Skipping event from {}: {}", source.getName(), e.getMessage());
                        skipped++;
                    }
                }
                logSkipped(source, skipped);
                return events;
            }
            case SourceConfig.TIER_SELECTORS: {
                List<RawEvent> raws = patternCrawler.crawl(source, token);
                result.setEventsFound(raws.size());
                List<EventInput> events = new ArrayList<>();
                int skipped = 0;
                for (RawEvent raw : limit(raws, options.limit())) {
                    try {
                        events.add(normalizer.normalizeRaw(raw, source));
                    } catch (NormalizationException e) {
                        logger.debug("Skipping raw event from {}: {}", source.getName(), e.getMessage());
                        skipped++;
                    }
                }
                logSkipped(source, skipped);
                return events;
            }
            default:
                throw new ScrapeException("unknown tier " + source.getTier() + " for source " + source.getName());
        }
    }

    private static <T> List<T> limit(List<T> records, int limit) {
        return limit > 0 && records.size() > limit ? records.subList(0, limit) : records;
    }

    private static void logSkipped(SourceConfig source, int skipped) {
        if (skipped > 0) {
            logger.warn("{} events from {} skipped during normalization", skipped, source.getName());
        }
    }

    // Bookkeeping is best-effort: a broken tracker or registry never fails a scrape.

    private String trackStarted(SourceConfig source) {
        try {
            return runTracker.runStarted(source.getName(), source.getUrl(), source.getTier());
        } catch (RuntimeException e) {
            logger.warn("Failed to record start of run for {}: {}", source.getName(), e.getMessage());
            return null;
        }
    }

    private void trackCompleted(String runId, ScrapeResult result) {
        try {
            runTracker.runCompleted(runId, result);
        } catch (RuntimeException e) {
            logger.warn("Failed to record completed run {}: {}", runId, e.getMessage());
        }
    }

    private void trackFailed(String runId, Exception error) {
        try {
            runTracker.runFailed(runId, error);
        } catch (RuntimeException e) {
            logger.warn("Failed to record failed run {}: {}", runId, e.getMessage());
        }
    }

    private void markScraped(String sourceName) {
        try {
            sourceRegistry.markScraped(sourceName);
        } catch (RuntimeException e) {
            logger.warn("Failed to mark {} as scraped: {}", sourceName, e.getMessage());
        }
    }
}
