package com.eventsync.domain.ports;

import com.eventsync.domain.model.SourceConfig;

import java.util.List;

/**
 * Port for the dynamic source registry. The orchestrator consults it before the
 * YAML source directory.
 */
public interface SourceRegistry {

    /**
     * Enabled sources only.
     *
     * @throws RuntimeException if the backing store cannot be read
     */
    List<SourceConfig> listEnabled();

    /**
     * All sources regardless of their enabled flag.
     */
    List<SourceConfig> listAll();

    /**
     * Inserts or updates a source by name.
     *
     * @return true if the source was created, false if an existing one was updated
     */
    boolean upsert(SourceConfig source);

    /**
     * Records that the named source has just been scraped.
     */
    void markScraped(String sourceName);
}
