package com.maestro.ensemblespec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;

/**
 * Performer source: jar name, performer class, string parameters and an optional explicit jar location.
 * The location content is opaque here; only its presence matters (it selects the dynamic jar repository).
 */
public final class SourceDefinition {

    private final String name;
    private final String classPath;
    private final Map<String, String> parameters;
    private final JsonNode location;

    @JsonCreator
    public SourceDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("classPath") String classPath,
            @JsonProperty("parameters") Map<String, String> parameters,
            @JsonProperty("location") JsonNode location) {
        this.name = name;
        this.classPath = classPath;
        this.parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
        this.location = location;
    }

    /** Jar file name (e.g. {@code my-performer.jar}). */
    public String getName() {
        return name;
    }

    /** Fully qualified performer class name inside the jar. */
    public String getClassPath() {
        return classPath;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    /** Explicit jar location as declared, or null when absent. */
    public JsonNode getLocation() {
        return location;
    }

    /** True when the source declares an explicit location (resolves against the dynamic jar repository). */
    public boolean hasExplicitLocation() {
        return location != null && !location.isNull();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceDefinition that = (SourceDefinition) o;
        return Objects.equals(name, that.name) && Objects.equals(classPath, that.classPath)
                && Objects.equals(parameters, that.parameters)
                && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, classPath, parameters, location);
    }
}
