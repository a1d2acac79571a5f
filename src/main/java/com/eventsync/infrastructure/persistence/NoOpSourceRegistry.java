package com.eventsync.infrastructure.persistence;

import com.eventsync.domain.model.SourceConfig;
import com.eventsync.domain.ports.SourceRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Empty registry, so source lookups fall back to the YAML directory.
 */
@Component
@ConditionalOnProperty(name = "scraper.mongo.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpSourceRegistry implements SourceRegistry {

    @Override
    public List<SourceConfig> listEnabled() {
        return List.of();
    }

    @Override
    public List<SourceConfig> listAll() {
        return List.of();
    }

    @Override
    public boolean upsert(SourceConfig source) {
        throw new IllegalStateException("no source registry configured (set scraper.mongo.enabled=true)");
    }

    @Override
    public void markScraped(String sourceName) {
    }
}
