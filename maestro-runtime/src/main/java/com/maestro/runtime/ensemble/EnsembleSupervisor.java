package com.maestro.runtime.ensemble;

import com.maestro.ensemblespec.graph.GraphModel;
import com.maestro.ensemblespec.model.EnsembleDefinition;
import com.maestro.runtime.supervision.FailureWindow;
import com.maestro.runtime.supervision.SupervisionDecision;
import com.maestro.runtime.supervision.TerminationCause;
import com.maestro.runtime.supervision.WorkerSupervisor;
import com.maestro.runtime.worker.WorkerHandle;
import com.maestro.telemetry.TelemetryNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one ensemble: builds its workers from an ensemble definition, supervises them with the bounded
 * restart policy and escalates to the {@link EscalationListener} when a worker terminates unexpectedly.
 * <p>
 * Escalation: phase ESCALATING, Terminate telemetry, every other worker unwatched and stopped, phase
 * TORN_DOWN, then an {@link EnsembleRestartRequired} signal. A failed build rolls back the same way.
 * All state changes happen under the supervisor lock; worker terminations reported during a build wait
 * for it and are handled once the build has completed. Reports from a previous generation are ignored.
 */
public final class EnsembleSupervisor implements WorkerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(EnsembleSupervisor.class);

    private final String ensembleId;
    private final EnsembleRuntime runtime;
    private final EscalationListener listener;
    private final TelemetryNotifier telemetry;
    private final Map<String, FailureWindow> failures = new ConcurrentHashMap<>();

    private EnsembleDefinition definition;
    private GraphModel model;
    private EnsembleState state;
    private volatile EnsemblePhase phase = EnsemblePhase.NEW;
    private volatile long generation;

    public EnsembleSupervisor(String ensembleId, EnsembleRuntime runtime, EscalationListener listener) {
        this.ensembleId = Objects.requireNonNull(ensembleId, "ensembleId");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.listener = listener != null ? listener : signal -> { };
        this.telemetry = runtime.getTelemetry();
    }

    /**
     * Builds every worker of the definition. Each worker begins executing as soon as it is created.
     *
     * @return success once every handle exists; failed (after rollback and signalling) otherwise
     * @throws IllegalStateException if the ensemble is already running or was stopped
     */
    public synchronized BuildOutcome start(EnsembleDefinition spec) {
        Objects.requireNonNull(spec, "spec");
        if (phase == EnsemblePhase.STOPPED) {
            throw new IllegalStateException("Ensemble " + ensembleId + " was stopped");
        }
        if (phase == EnsemblePhase.RUNNING || phase == EnsemblePhase.BUILDING) {
            throw new IllegalStateException("Ensemble " + ensembleId + " is already " + phase);
        }
        if (spec.getGuid() != null && !ensembleId.equals(spec.getGuid())) {
            log.warn("Specification guid={} differs from ensemble={}; using ensemble id", spec.getGuid(), ensembleId);
        }
        this.definition = spec;
        return build();
    }

    /**
     * Full rebuild from the original specification: tears down live workers, emits Restart and builds
     * the next generation.
     *
     * @throws IllegalStateException if never started or already stopped
     */
    public synchronized BuildOutcome restart(String reason) {
        if (phase == EnsemblePhase.STOPPED) {
            throw new IllegalStateException("Ensemble " + ensembleId + " was stopped");
        }
        if (definition == null) {
            throw new IllegalStateException("Ensemble " + ensembleId + " was never started");
        }
        if (state != null) {
            stopAll(state.getHandles().values());
            state = null;
        }
        log.info("Restarting ensemble={} generation={} reason={}", ensembleId, generation, reason);
        telemetry.restart(ensembleId, reason);
        return build();
    }

    private BuildOutcome build() {
        phase = EnsemblePhase.BUILDING;
        generation++;
        failures.clear();
        telemetry.start(ensembleId);
        WorkerInstantiator instantiator = null;
        try {
            model = runtime.getGraphModelBuilder().build(definition);
            instantiator = new WorkerInstantiator(model, runtime, ensembleId, this);
            Map<String, WorkerHandle> handles = instantiator.materializeAll();
            state = new EnsembleState(model, handles, generation);
            phase = EnsemblePhase.RUNNING;
            log.info("Ensemble={} generation={} running\n{}", ensembleId, generation, render());
            return BuildOutcome.success(snapshot());
        } catch (EnsembleBuildException | IllegalArgumentException e) {
            log.error("During performer creation for ensemble={} generation={}: {}", ensembleId, generation, e.getMessage());
            return rollBack(instantiator, e);
        } catch (RuntimeException | Error e) {
            log.error("Unexpected failure while building ensemble={} generation={}", ensembleId, generation, e);
            BuildOutcome outcome = rollBack(instantiator, e);
            if (e instanceof VirtualMachineError) {
                throw e;
            }
            return outcome;
        }
    }

    private BuildOutcome rollBack(WorkerInstantiator instantiator, Throwable cause) {
        if (instantiator != null) {
            stopAll(instantiator.getCreated().values());
        }
        state = null;
        phase = EnsemblePhase.TORN_DOWN;
        EnsembleRestartRequired signal = new EnsembleRestartRequired(ensembleId, generation,
                "Not able to create the Performers: " + cause.getMessage(), null, cause, System.currentTimeMillis());
        listener.onRestartRequired(signal);
        return BuildOutcome.failed(signal);
    }

    /**
     * Stops every worker (one fire-and-forget stop each), emits Stop and discards the state. Idempotent.
     */
    public synchronized void stop() {
        if (phase == EnsemblePhase.STOPPED) {
            return;
        }
        if (state != null) {
            stopAll(state.getHandles().values());
        }
        state = null;
        phase = EnsemblePhase.STOPPED;
        telemetry.stop(ensembleId);
        log.info("Stopped ensemble={} generation={}", ensembleId, generation);
    }

    @Override
    public SupervisionDecision onFailure(WorkerHandle worker, Throwable cause) {
        FailureWindow window = failures.computeIfAbsent(worker.getAddress(), a -> runtime.getRestartPolicy().newWindow());
        SupervisionDecision decision = runtime.getRestartPolicy().decide(window);
        log.debug("Supervision decision for performer={} ensemble={}: {}", worker.getId(), ensembleId, decision);
        return decision;
    }

    @Override
    public synchronized void onTerminated(WorkerHandle worker, TerminationCause cause) {
        if (phase != EnsemblePhase.RUNNING || state == null || state.getHandles().get(worker.getId()) != worker) {
            log.debug("Ignoring termination of {} in ensemble={} phase={}", worker.getAddress(), ensembleId, phase);
            return;
        }
        phase = EnsemblePhase.ESCALATING;
        String address = worker.getAddress();
        telemetry.terminate(ensembleId, address);
        log.error("DEAD Performer {} ensemble={} generation={} cause={}", worker.getId(), ensembleId, generation,
                cause.failure() != null ? cause.failure().toString() : cause.kind().name());
        List<WorkerHandle> others = new ArrayList<>(state.getHandles().values());
        others.remove(worker);
        worker.unwatch();
        stopAll(others);
        state = null;
        phase = EnsemblePhase.TORN_DOWN;
        listener.onRestartRequired(new EnsembleRestartRequired(ensembleId, generation,
                "DEAD Performer " + worker.getId(), address, cause.failure(), System.currentTimeMillis()));
    }

    private static void stopAll(Collection<WorkerHandle> handles) {
        for (WorkerHandle h : handles) {
            h.unwatch();
        }
        for (WorkerHandle h : handles) {
            h.stop();
        }
    }

    /** Read-only view; no side effects. */
    public synchronized EnsembleSnapshot describe() {
        return snapshot();
    }

    private EnsembleSnapshot snapshot() {
        List<String> addresses = new ArrayList<>();
        if (state != null) {
            for (WorkerHandle h : state.getHandles().values()) addresses.add(h.getAddress());
        }
        return new EnsembleSnapshot(ensembleId, generation, phase,
                model != null ? model.getConnections() : Map.of(),
                model != null ? new ArrayList<>(model.getPerformerIds()) : List.of(),
                addresses);
    }

    /**
     * Logs the edges, nodes and performers, and asks every worker to log its address.
     */
    public synchronized void printEnsemble() {
        log.info("Ensemble={}\n{}", ensembleId, render());
        if (state != null) {
            for (WorkerHandle h : state.getHandles().values()) h.printPath();
        }
    }

    private String render() {
        String edges = model != null ? model.describeEdges() : "";
        String nodes = model != null ? model.describeNodes() : "[]";
        String performers = "[" + String.join(" | ", getWorkerNames()) + "]";
        return "Edges: \n" + edges + " \nNodes: \n\t" + nodes + " \nPerformers \n\t" + performers;
    }

    public String getEnsembleId() {
        return ensembleId;
    }

    public EnsemblePhase getPhase() {
        return phase;
    }

    public long getGeneration() {
        return generation;
    }

    /** Performer ids of the live workers. */
    public synchronized Set<String> getWorkerNames() {
        return state != null ? new LinkedHashSet<>(state.getHandles().keySet()) : Set.of();
    }

    public synchronized Optional<WorkerHandle> getHandle(String performerId) {
        return state != null ? Optional.ofNullable(state.getHandles().get(performerId)) : Optional.empty();
    }

    @Override
    public synchronized String toString() {
        return render();
    }
}
