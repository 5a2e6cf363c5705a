package com.maestro.ensemblespec.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory graph of one ensemble: performer specifications by id and connection edges
 * (source id → ordered dependency ids). Both maps keep declaration order. Cross-references are
 * not validated here; the instantiator fails on the first unknown id it meets.
 */
public final class GraphModel {

    private final Map<String, PerformerSpec> performers;
    private final Map<String, List<String>> connections;

    public GraphModel(Map<String, PerformerSpec> performers, Map<String, List<String>> connections) {
        this.performers = Collections.unmodifiableMap(new LinkedHashMap<>(performers));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        connections.forEach((source, deps) -> copy.put(source, List.copyOf(deps)));
        this.connections = Collections.unmodifiableMap(copy);
    }

    public Map<String, PerformerSpec> getPerformers() {
        return performers;
    }

    public Map<String, List<String>> getConnections() {
        return connections;
    }

    /** Performer spec for the id, or null if the id is not declared. */
    public PerformerSpec getPerformer(String id) {
        return performers.get(id);
    }

    /** Declared dependencies of the id; empty when it has no connection entry. */
    public List<String> getDependencies(String id) {
        return connections.getOrDefault(id, List.of());
    }

    public Set<String> getPerformerIds() {
        return performers.keySet();
    }

    /**
     * Edges rendered one per line as {@code source : [dep1,dep2]}, in declaration order.
     */
    public String describeEdges() {
        StringBuilder sb = new StringBuilder();
        connections.forEach((source, deps) -> {
            if (sb.length() > 0) sb.append('\n');
            sb.append(" \t ").append(source).append(" : [").append(String.join(",", deps)).append(']');
        });
        return sb.toString();
    }

    /** Performer ids rendered as {@code [a,b,c]}. */
    public String describeNodes() {
        return "[" + String.join(",", performers.keySet()) + "]";
    }
}
