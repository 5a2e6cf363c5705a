package com.maestro.ensemblespec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of an ensemble specification: guid, optional command, connection records and performer records.
 * Each connection record maps one or more source guids to the guids they depend on.
 */
public final class EnsembleDefinition {

    private final String guid;
    private final String command;
    private final List<Map<String, List<String>>> connections;
    private final List<PerformerDefinition> performers;

    @JsonCreator
    public EnsembleDefinition(
            @JsonProperty("guid") String guid,
            @JsonProperty("command") String command,
            @JsonProperty("connections") List<Map<String, List<String>>> connections,
            @JsonProperty("performers") List<PerformerDefinition> performers) {
        this.guid = guid;
        this.command = command;
        this.connections = connections != null ? copyConnections(connections) : List.of();
        this.performers = performers != null ? List.copyOf(performers) : List.of();
    }

    private static List<Map<String, List<String>>> copyConnections(List<Map<String, List<String>>> connections) {
        List<Map<String, List<String>>> out = new ArrayList<>(connections.size());
        for (Map<String, List<String>> record : connections) {
            // LinkedHashMap view keeps the declared key order of the record
            out.add(record != null ? Collections.unmodifiableMap(record) : Map.of());
        }
        return Collections.unmodifiableList(out);
    }

    public String getGuid() {
        return guid;
    }

    /** Orchestration command (e.g. CREATE, UPDATE, DELETE); informational for the runtime. */
    public String getCommand() {
        return command;
    }

    public List<Map<String, List<String>>> getConnections() {
        return connections;
    }

    public List<PerformerDefinition> getPerformers() {
        return performers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EnsembleDefinition that = (EnsembleDefinition) o;
        return Objects.equals(guid, that.guid) && Objects.equals(command, that.command)
                && Objects.equals(connections, that.connections) && Objects.equals(performers, that.performers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(guid, command, connections, performers);
    }
}
