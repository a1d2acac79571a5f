package com.eventsync.application.usecase;

import com.eventsync.domain.exception.SourceConfigException;
import com.eventsync.domain.model.SourceConfig;
import com.eventsync.domain.ports.SourceRegistry;
import com.eventsync.infrastructure.source.YamlSourceConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies source definitions between the YAML directory and the source registry.
 */
@Service
public class SyncSourcesUseCase {

    private static final Logger logger = LoggerFactory.getLogger(SyncSourcesUseCase.class);

    private final SourceRegistry sourceRegistry;
    private final YamlSourceConfigLoader sourceLoader;

    public SyncSourcesUseCase(SourceRegistry sourceRegistry, YamlSourceConfigLoader sourceLoader) {
        this.sourceRegistry = sourceRegistry;
        this.sourceLoader = sourceLoader;
    }

    /**
     * Upserts every valid YAML source into the registry. Invalid files are reported
     * as warnings; the valid ones are synced anyway.
     *
     * @throws SourceConfigException if a file cannot be read or parsed
     */
    public SyncSummary sync(Path sourcesDir) throws SourceConfigException {
        List<String> warnings = new ArrayList<>();
        List<SourceConfig> sources;
        try {
            sources = sourceLoader.loadDirectory(sourcesDir);
        } catch (SourceConfigException e) {
            if (e.getProblems().isEmpty()) {
                throw e;
            }
            warnings.addAll(e.getProblems());
            sources = e.getValidSources();
        }

        int created = 0;
        int updated = 0;
        int failed = 0;
        for (SourceConfig source : sources) {
            try {
                if (sourceRegistry.upsert(source)) {
                    created++;
                } else {
                    updated++;
                }
            } catch (RuntimeException e) {
                failed++;
                warnings.add("upsert " + source.getName() + ": " + e.getMessage());
                logger.warn("Failed to sync source {}: {}", source.getName(), e.getMessage());
            }
        }

        logger.info("Sync complete: {} created, {} updated, {} failed (total {} sources)",
            created, updated, failed, sources.size());
        return new SyncSummary(created, updated, failed, warnings);
    }

    /**
     * Writes every registry source, enabled or not, to one YAML file in {@code outputDir}.
     * Existing files are overwritten.
     *
     * @return the files written
     */
    public List<Path> export(Path outputDir) {
        List<Path> written = new ArrayList<>();
        for (SourceConfig source : sourceRegistry.listAll()) {
            Path file = outputDir.resolve(YamlSourceConfigLoader.fileNameFor(source));
            try {
                sourceLoader.writeFile(source, file);
                written.add(file);
                logger.debug("Exported {} to {}", source.getName(), file);
            } catch (IOException e) {
                logger.warn("Failed to export {} to {}: {}", source.getName(), file, e.getMessage());
            }
        }
        logger.info("Export complete: {} sources written to {}", written.size(), outputDir);
        return written;
    }

    public record SyncSummary(
        int created,
        int updated,
        int failed,
        List<String> warnings
    ) {}
}
