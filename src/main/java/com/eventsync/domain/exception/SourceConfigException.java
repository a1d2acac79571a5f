package com.eventsync.domain.exception;

import com.eventsync.domain.model.SourceConfig;

import java.util.List;

/**
 * Invalid source definition(s). When raised by a directory load it also carries
 * the sources that did validate, so callers can decide to carry on with them.
 */
public class SourceConfigException extends ScrapeException {

    private final List<SourceConfig> validSources;
    private final List<String> problems;

    public SourceConfigException(String message) {
        this(message, List.of(), List.of());
    }

    public SourceConfigException(String message, Throwable cause) {
        super(message, cause);
        this.validSources = List.of();
        this.problems = List.of();
    }

    public SourceConfigException(String message, List<String> problems, List<SourceConfig> validSources) {
        super(message);
        this.problems = List.copyOf(problems);
        this.validSources = List.copyOf(validSources);
    }

    public List<SourceConfig> getValidSources() {
        return validSources;
    }

    public List<String> getProblems() {
        return problems;
    }
}
