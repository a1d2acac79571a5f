package com.eventsync.infrastructure.source;

import com.eventsync.domain.model.SourceConfig;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks a {@link SourceConfig} and reports every problem found, one message per field.
 */
public final class SourceConfigValidator {

    private static final Set<String> SCHEDULES = Set.of("daily", "weekly", "manual");

    private SourceConfigValidator() {
    }

    /**
     * @return the problems found; empty when the source is valid
     */
    public static List<String> validate(SourceConfig config) {
        List<String> problems = new ArrayList<>();

        if (isBlank(config.getName())) {
            problems.add("name: required");
        }

        if (isBlank(config.getUrl())) {
            problems.add("url: required");
        } else if (!isHttpUrl(config.getUrl())) {
            problems.add("url: must be a valid http/https URL, got \"" + config.getUrl() + "\"");
        }

        if (config.getTier() != SourceConfig.TIER_STRUCTURED && config.getTier() != SourceConfig.TIER_SELECTORS) {
            problems.add("tier: must be 0 or 1, got " + config.getTier());
        }

        if (config.getTrustLevel() < 1 || config.getTrustLevel() > 10) {
            problems.add("trust_level: must be 1-10, got " + config.getTrustLevel());
        }

        if (config.getTier() == SourceConfig.TIER_SELECTORS && isBlank(config.selectorsOrEmpty().eventList())) {
            problems.add("selectors.event_list: required for tier 1");
        }

        if (!isBlank(config.getSchedule()) && !SCHEDULES.contains(config.getSchedule())) {
            problems.add("schedule: must be daily, weekly, or manual, got \"" + config.getSchedule() + "\"");
        }

        if (config.getMaxPages() < 0) {
            problems.add("max_pages: must be >= 0, got " + config.getMaxPages());
        }

        return problems;
    }

    static boolean isHttpUrl(String url) {
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                && uri.getHost() != null && !uri.getHost().isEmpty();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
