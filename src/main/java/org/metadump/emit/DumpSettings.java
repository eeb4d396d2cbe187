package org.metadump.emit;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.metadump.output.Section;

import com.typesafe.config.Config;

/**
 * Where a dump run writes its output, fixed once at start.
 * <p>
 * Read from the {@code metadump} block of the application configuration:
 * <pre>
 * metadump {
 *   outputDirectory = "backup"
 *   workers = 3
 *   tocFile = "toc.json"
 *   sections {
 *     global = "metadata_global.sql"
 *     predata = "metadata_predata.sql"
 *     postdata = "metadata_postdata.sql"
 *   }
 * }
 * </pre>
 * Relative destinations resolve against {@code outputDirectory}; every section needs one.
 */
public final class DumpSettings {

    private final Path outputDirectory;
    private final Map<Section, Path> destinations;
    private final Path tocFile;
    private final int workers;

    public DumpSettings(Path outputDirectory, Map<Section, Path> destinations, Path tocFile, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        this.outputDirectory = outputDirectory;
        this.destinations = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            Path destination = destinations.get(section);
            if (destination == null) {
                throw new IllegalArgumentException("No destination configured for the " + section.tag() + " section");
            }
            this.destinations.put(section, outputDirectory.resolve(destination));
        }
        this.tocFile = outputDirectory.resolve(tocFile);
        this.workers = workers;
    }

    /**
     * @param config the {@code metadump} configuration block.
     * @return the settings.
     * @throws com.typesafe.config.ConfigException if a required key is missing or mistyped.
     */
    public static DumpSettings fromConfig(Config config) {
        Config sections = config.getConfig("sections");
        Map<Section, Path> destinations = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            if (sections.hasPath(section.tag())) {
                destinations.put(section, Path.of(sections.getString(section.tag())));
            }
        }
        return new DumpSettings(
                Path.of(config.getString("outputDirectory")),
                destinations,
                Path.of(config.getString("tocFile")),
                config.getInt("workers"));
    }

    /**
     * @return a copy writing below another directory, keeping relative destinations relative.
     */
    public DumpSettings withOutputDirectory(Path directory) {
        Map<Section, Path> relative = new EnumMap<>(Section.class);
        for (Map.Entry<Section, Path> entry : destinations.entrySet()) {
            relative.put(entry.getKey(), relativize(entry.getValue()));
        }
        return new DumpSettings(directory, relative, relativize(tocFile), workers);
    }

    private Path relativize(Path path) {
        return path.startsWith(outputDirectory) ? outputDirectory.relativize(path) : path;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public Path destination(Section section) {
        return destinations.get(section);
    }

    public Map<Section, Path> destinations() {
        return Collections.unmodifiableMap(destinations);
    }

    public Path tocFile() {
        return tocFile;
    }

    public int workers() {
        return workers;
    }
}
