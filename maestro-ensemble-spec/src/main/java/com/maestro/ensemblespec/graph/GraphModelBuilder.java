package com.maestro.ensemblespec.graph;

import com.maestro.ensemblespec.model.EnsembleDefinition;
import com.maestro.ensemblespec.model.PerformerDefinition;
import com.maestro.ensemblespec.model.SourceDefinition;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link GraphModel} from a parsed {@link EnsembleDefinition}.
 * <p>
 * Connections: all records are flattened into one map; a later record overwrites an earlier one for the
 * same source id. Performers: schedule and backoff are milliseconds; absent autoScale is 0 and absent
 * controlAware is false; a source with an explicit location resolves against the dynamic jar repository,
 * otherwise against the static one.
 */
public final class GraphModelBuilder {

    private final Path jarRepository;
    private final Path dynamicJarRepository;

    /**
     * @param jarRepository        static jar repository root
     * @param dynamicJarRepository dynamic jar repository root (sources with explicit location)
     */
    public GraphModelBuilder(Path jarRepository, Path dynamicJarRepository) {
        this.jarRepository = Objects.requireNonNull(jarRepository, "jarRepository");
        this.dynamicJarRepository = Objects.requireNonNull(dynamicJarRepository, "dynamicJarRepository");
    }

    public GraphModel build(EnsembleDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        return new GraphModel(extractPerformers(definition.getPerformers()), extractConnections(definition.getConnections()));
    }

    /**
     * Flattens connection records into one ordered map. Duplicate keys: last seen wins.
     */
    public static Map<String, List<String>> extractConnections(List<Map<String, List<String>>> records) {
        Map<String, List<String>> connections = new LinkedHashMap<>();
        for (Map<String, List<String>> record : records) {
            for (Map.Entry<String, List<String>> e : record.entrySet()) {
                List<String> deps = e.getValue() != null ? e.getValue() : List.of();
                connections.put(e.getKey(), List.copyOf(deps));
            }
        }
        return connections;
    }

    /**
     * Extracts performer specifications keyed by guid, in declaration order.
     *
     * @throws IllegalArgumentException if a required field is missing
     */
    public Map<String, PerformerSpec> extractPerformers(List<PerformerDefinition> records) {
        Map<String, PerformerSpec> performers = new LinkedHashMap<>();
        for (PerformerDefinition p : records) {
            PerformerSpec spec = toSpec(p);
            performers.put(spec.id(), spec);
        }
        return performers;
    }

    private PerformerSpec toSpec(PerformerDefinition p) {
        String id = p.getGuid();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Performer without guid");
        }
        int schedule = require(p.getSchedule(), "schedule", id);
        int backoff = require(p.getBackoff(), "backoff", id);
        SourceDefinition source = p.getSource();
        if (source == null) {
            throw new IllegalArgumentException("Performer " + id + " has no source");
        }
        if (source.getClassPath() == null || source.getClassPath().isBlank()) {
            throw new IllegalArgumentException("Performer " + id + " source has no classPath");
        }
        if (source.getName() == null || source.getName().isBlank()) {
            throw new IllegalArgumentException("Performer " + id + " source has no name");
        }
        int autoScale = p.getAutoScale() != null ? p.getAutoScale() : 0;
        boolean controlAware = p.getControlAware() != null && p.getControlAware();
        Path location = source.hasExplicitLocation() ? dynamicJarRepository : jarRepository;
        return new PerformerSpec(id, source.getName(), source.getClassPath(), source.getParameters(),
                Duration.ofMillis(schedule), Duration.ofMillis(backoff), autoScale, controlAware, location);
    }

    private static int require(Integer value, String field, String id) {
        if (value == null) {
            throw new IllegalArgumentException("Performer " + id + " is missing required field '" + field + "'");
        }
        if (value < 0) {
            throw new IllegalArgumentException("Performer " + id + " has negative " + field + ": " + value);
        }
        return value;
    }
}
