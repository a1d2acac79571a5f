package com.eventsync.infrastructure.source;

import com.eventsync.domain.exception.SourceConfigException;
import com.eventsync.domain.model.SourceConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads source definitions from YAML files, one source per file.
 *
 * <pre>
 * name: city-hall-events
 * url: https://example.org/events
 * tier: 1
 * selectors:
 *   event_list: ".event-card"
 *   name: "h3"
 * </pre>
 */
public class YamlSourceConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(YamlSourceConfigLoader.class);

    private final ObjectMapper yaml;

    public YamlSourceConfigLoader() {
        this.yaml = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Loads and validates a single file.
     *
     * @throws SourceConfigException when the file cannot be read or parsed, or is invalid
     */
    public SourceConfig loadFile(Path file) throws SourceConfigException {
        SourceConfig config = parse(file);
        List<String> problems = SourceConfigValidator.validate(config);
        if (!problems.isEmpty()) {
            throw new SourceConfigException(file + ": " + String.join("; ", problems), problems, List.of());
        }
        return config;
    }

    /**
     * Loads every {@code *.yaml} / {@code *.yml} file directly inside {@code dir}.
     * Files starting with {@code _} are skipped. A missing directory yields an empty list.
     *
     * @throws SourceConfigException if a file cannot be parsed, or if any source is invalid
     *                               or duplicated; in the latter case the valid ones are
     *                               available from {@link SourceConfigException#getValidSources()}
     */
    public List<SourceConfig> loadDirectory(Path dir) throws SourceConfigException {
        if (!Files.isDirectory(dir)) {
            logger.debug("Source config directory {} does not exist", dir);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> entries = Files.list(dir)) {
            files = entries
                .filter(Files::isRegularFile)
                .filter(YamlSourceConfigLoader::isSourceFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SourceConfigException("reading source config dir " + dir + ": " + e.getMessage(), e);
        }

        List<SourceConfig> valid = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        Map<String, Path> seenNames = new HashMap<>();

        for (Path file : files) {
            SourceConfig config = parse(file);

            List<String> fileProblems = SourceConfigValidator.validate(config);
            if (!fileProblems.isEmpty()) {
                problems.add(file + ": " + String.join("; ", fileProblems));
                continue;
            }

            String key = config.getName().toLowerCase(Locale.ROOT);
            Path previous = seenNames.putIfAbsent(key, file);
            if (previous != null) {
                problems.add(file + ": duplicate source name \"" + config.getName() + "\" (already defined in "
                    + previous.getFileName() + ")");
                continue;
            }
            valid.add(config);
        }

        logger.info("Loaded {} source configs from {}", valid.size(), dir);

        if (!problems.isEmpty()) {
            throw new SourceConfigException("invalid source configs:\n  " + String.join("\n  ", problems),
                problems, valid);
        }
        return valid;
    }

    /**
     * Writes a source definition in the same format {@link #loadFile(Path)} reads.
     */
    public void writeFile(SourceConfig config, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        yaml.writeValue(file.toFile(), config);
    }

    /**
     * File name a source is exported to: lower-case name with anything but letters,
     * digits and dashes replaced by a dash.
     */
    public static String fileNameFor(SourceConfig config) {
        String slug = config.getName().toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9-]+", "-")
            .replaceAll("-+", "-")
            .replaceAll("^-|-$", "");
        return (slug.isEmpty() ? "source" : slug) + ".yaml";
    }

    private SourceConfig parse(Path file) throws SourceConfigException {
        try {
            SourceConfig config = yaml.readValue(file.toFile(), SourceConfig.class);
            if (config == null) {
                throw new SourceConfigException(file + ": empty file");
            }
            return config;
        } catch (IOException e) {
            throw new SourceConfigException("loading " + file + ": " + e.getMessage(), e);
        }
    }

    static boolean isSourceFile(Path file) {
        String name = file.getFileName().toString();
        if (name.startsWith("_")) {
            return false;
        }
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
