package com.eventsync.domain.model;

/**
 * Options for one orchestration call.
 *
 * @param limit      maximum raw records normalized per source, 0 for no limit
 * @param sourcesDir directory with YAML source files, used when the registry has nothing
 * @param schedule   when set, only sources with this schedule are scraped by {@code scrapeAll}
 */
public record ScrapeOptions(boolean dryRun, int limit, String sourcesDir, String schedule) {

    public static final String DEFAULT_SOURCES_DIR = "configs/sources";

    public ScrapeOptions {
        if (limit < 0) {
            limit = 0;
        }
        if (sourcesDir == null || sourcesDir.isBlank()) {
            sourcesDir = DEFAULT_SOURCES_DIR;
        }
    }

    public static ScrapeOptions defaults() {
        return new ScrapeOptions(false, 0, DEFAULT_SOURCES_DIR, null);
    }

    public ScrapeOptions withDryRun(boolean dryRun) {
        return new ScrapeOptions(dryRun, limit, sourcesDir, schedule);
    }

    public ScrapeOptions withLimit(int limit) {
        return new ScrapeOptions(dryRun, limit, sourcesDir, schedule);
    }

    public ScrapeOptions withSourcesDir(String sourcesDir) {
        return new ScrapeOptions(dryRun, limit, sourcesDir, schedule);
    }

    public ScrapeOptions withSchedule(String schedule) {
        return new ScrapeOptions(dryRun, limit, sourcesDir, schedule);
    }
}
