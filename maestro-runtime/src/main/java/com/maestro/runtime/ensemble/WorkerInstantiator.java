package com.maestro.runtime.ensemble;

import com.maestro.ensemblespec.graph.GraphModel;
import com.maestro.ensemblespec.graph.PerformerSpec;
import com.maestro.plugin.LoadError;
import com.maestro.plugin.PerformerContext;
import com.maestro.plugin.PerformerFactory;
import com.maestro.plugin.PerformerRef;
import com.maestro.runtime.pool.ElasticPool;
import com.maestro.runtime.pool.PoolResizer;
import com.maestro.runtime.supervision.WorkerSupervisor;
import com.maestro.runtime.worker.WorkerHandle;
import com.maestro.runtime.worker.WorkerTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Materializes the workers of one build pass, dependency first. Keeps a build-local map of created
 * handles so a shared dependency is built exactly once; a second pass creates performers that no
 * connection reaches. Not thread-safe: one instance per build.
 */
public final class WorkerInstantiator {

    private static final Logger log = LoggerFactory.getLogger(WorkerInstantiator.class);

    private final GraphModel model;
    private final EnsembleRuntime runtime;
    private final String ensembleId;
    private final WorkerSupervisor watcher;
    private final Map<String, WorkerHandle> created = new LinkedHashMap<>();
    private final LinkedHashSet<String> inProgress = new LinkedHashSet<>();

    public WorkerInstantiator(GraphModel model, EnsembleRuntime runtime, String ensembleId, WorkerSupervisor watcher) {
        this.model = Objects.requireNonNull(model, "model");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.ensembleId = Objects.requireNonNull(ensembleId, "ensembleId");
        this.watcher = Objects.requireNonNull(watcher, "watcher");
    }

    /**
     * Materializes every performer: connection sources first (in declaration order), then the rest.
     *
     * @return handles by performer id, in creation order
     * @throws EnsembleBuildException on the first failure; handles created so far stay in {@link #getCreated()}
     */
    public Map<String, WorkerHandle> materializeAll() {
        for (String source : model.getConnections().keySet()) {
            materialize(source);
        }
        for (String id : model.getPerformerIds()) {
            if (!created.containsKey(id)) {
                materialize(id);
            }
        }
        return getCreated();
    }

    /**
     * Returns the handle for the id, creating it and its dependencies if needed.
     *
     * @throws UnknownPerformerException   if the id has no performer definition
     * @throws ConnectionCycleException    if the id depends on itself through its connections
     * @throws PerformerCreationException  if the performer cannot be loaded or created, including a
     *                                     {@link LinkageError} raised by the performer jar
     */
    public WorkerHandle materialize(String id) {
        WorkerHandle existing = created.get(id);
        if (existing != null) {
            return existing;
        }
        if (inProgress.contains(id)) {
            throw new ConnectionCycleException(cyclePath(id));
        }
        PerformerSpec spec = model.getPerformer(id);
        if (spec == null) {
            log.error("Performer {} is not defined in ensemble={}", id, ensembleId);
            throw new UnknownPerformerException(id);
        }
        inProgress.add(id);
        try {
            Map<String, PerformerRef> connections = new LinkedHashMap<>();
            for (String dependency : model.getDependencies(id)) {
                connections.put(dependency, materialize(dependency));
            }
            WorkerHandle handle = create(spec, connections);
            created.put(id, handle);
            return handle;
        } finally {
            inProgress.remove(id);
        }
    }

    /** Handles created so far in this pass. */
    public Map<String, WorkerHandle> getCreated() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(created));
    }

    private List<String> cyclePath(String id) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (String step : inProgress) {
            if (step.equals(id)) inCycle = true;
            if (inCycle) path.add(step);
        }
        path.add(id);
        return path;
    }

    private WorkerHandle create(PerformerSpec spec, Map<String, PerformerRef> connections) {
        PerformerFactory factory;
        try {
            factory = runtime.getPluginLoader().load(spec.classPath(), spec.jarLocation(), spec.jarName());
        } catch (LoadError e) {
            log.error("Could not load class {} from jar {} for performer={} ensemble={}. Check the jar repository path and the jar name",
                    spec.classPath(), spec.jarPath(), spec.id(), ensembleId, e);
            throw new PerformerCreationException(spec.id(), spec.classPath(), spec.jarName(), e);
        }
        PerformerContext context = PerformerContext.builder()
                .performerId(spec.id())
                .parameters(spec.parameters())
                .backoff(spec.backoff())
                .schedule(spec.schedule())
                .connections(connections)
                .ensembleId(ensembleId)
                .orchestrationId(runtime.getOrchestrationId())
                .orchestrationName(runtime.getOrchestrationName())
                .autoScaled(spec.isPooled())
                .build();
        WorkerTemplate template = new WorkerTemplate(spec.id(), factory, context, runtime.getDispatcher(), spec.controlAware());
        String address = runtime.addressOf(ensembleId) + "/" + spec.id();
        try {
            if (spec.isPooled()) {
                ElasticPool pool = new ElasticPool(address, template,
                        new PoolResizer(spec.autoScale(), runtime.getPoolSettings()), runtime.getRestartPolicy());
                pool.watch(watcher);
                pool.start();
                return pool;
            }
            return template.spawn(address, watcher);
        } catch (Exception | LinkageError e) {
            log.error("Problems while creating performer={} (class={}, jar={}) ensemble={}",
                    spec.id(), spec.classPath(), spec.jarName(), ensembleId, e);
            throw new PerformerCreationException(spec.id(), spec.classPath(), spec.jarName(), e);
        }
    }
}
