package com.maestro.runtime.ensemble;

import com.maestro.ensemblespec.graph.GraphModel;
import com.maestro.runtime.worker.WorkerHandle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Live state of one built ensemble: graph, worker handles by performer id, and the generation that built them.
 */
public final class EnsembleState {

    private final GraphModel model;
    private final Map<String, WorkerHandle> handles;
    private final long generation;

    public EnsembleState(GraphModel model, Map<String, WorkerHandle> handles, long generation) {
        this.model = Objects.requireNonNull(model, "model");
        this.handles = Collections.unmodifiableMap(new LinkedHashMap<>(handles));
        this.generation = generation;
    }

    public GraphModel getModel() {
        return model;
    }

    public Map<String, WorkerHandle> getHandles() {
        return handles;
    }

    public long getGeneration() {
        return generation;
    }
}
