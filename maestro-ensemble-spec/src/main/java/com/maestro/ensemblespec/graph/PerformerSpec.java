package com.maestro.ensemblespec.graph;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable performer specification extracted from an ensemble definition at graph-build time.
 * {@code jarLocation} is the repository directory the jar resolves against (static or dynamic root);
 * {@code autoScale} is the pool upper bound, 0 meaning a single worker.
 */
public record PerformerSpec(
        String id,
        String jarName,
        String classPath,
        Map<String, String> parameters,
        Duration schedule,
        Duration backoff,
        int autoScale,
        boolean controlAware,
        Path jarLocation
) {
    public PerformerSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(classPath, "classPath");
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
        schedule = schedule != null ? schedule : Duration.ZERO;
        backoff = backoff != null ? backoff : Duration.ZERO;
        if (autoScale < 0) {
            throw new IllegalArgumentException("autoScale must be >= 0 for performer " + id + ": " + autoScale);
        }
    }

    /** True when the performer runs as an elastic pool. */
    public boolean isPooled() {
        return autoScale > 0;
    }

    /** Full jar path: {@code jarLocation/jarName}. */
    public Path jarPath() {
        return jarLocation != null ? jarLocation.resolve(jarName) : Path.of(jarName);
    }
}
