package com.maestro.bootstrap;

import com.maestro.ensemblespec.model.EnsembleDefinition;
import com.maestro.runtime.ensemble.BuildOutcome;
import com.maestro.runtime.ensemble.EnsembleRestartRequired;
import com.maestro.runtime.ensemble.EnsembleRuntime;
import com.maestro.runtime.ensemble.EnsembleSupervisor;
import com.maestro.runtime.ensemble.EscalationListener;
import com.maestro.runtime.supervision.FailureWindow;
import com.maestro.runtime.supervision.RestartPolicy;
import com.maestro.runtime.supervision.SupervisionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Parent of the ensembles of one orchestration. Receives their restart signals and rebuilds the
 * signalling ensemble in full on a dedicated thread, never on the worker thread that reported the death.
 * Rebuilds per ensemble are bounded by a {@link RestartPolicy}; once exhausted the ensemble is stopped
 * and removed.
 */
public final class Orchestration implements EscalationListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestration.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final EnsembleRuntime runtime;
    private final RestartPolicy rebuildPolicy;
    private final ExecutorService rebuilds;
    private final Map<String, EnsembleSupervisor> ensembles = new ConcurrentHashMap<>();
    private final Map<String, FailureWindow> rebuildWindows = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    public Orchestration(EnsembleRuntime runtime, RestartPolicy rebuildPolicy) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.rebuildPolicy = Objects.requireNonNull(rebuildPolicy, "rebuildPolicy");
        this.rebuilds = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "maestro-orchestration-" + runtime.getOrchestrationId());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates a supervisor for the definition and builds it. A failed build is signalled like any
     * other escalation and rebuilt within the rebuild bound.
     *
     * @throws IllegalArgumentException if the definition has no guid
     * @throws IllegalStateException    if an ensemble with the same id exists or the orchestration is shut down
     */
    public BuildOutcome createEnsemble(EnsembleDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        String ensembleId = definition.getGuid();
        if (ensembleId == null || ensembleId.isBlank()) {
            throw new IllegalArgumentException("Ensemble definition has no guid");
        }
        if (shutdown) {
            throw new IllegalStateException("Orchestration " + runtime.getOrchestrationId() + " is shut down");
        }
        EnsembleSupervisor supervisor = new EnsembleSupervisor(ensembleId, runtime, this);
        if (ensembles.putIfAbsent(ensembleId, supervisor) != null) {
            throw new IllegalStateException("Ensemble " + ensembleId + " already exists");
        }
        log.info("Creating ensemble={} in orchestration={}", ensembleId, runtime.getOrchestrationId());
        return supervisor.start(definition);
    }

    /**
     * Stops and removes the ensemble.
     *
     * @return false if no such ensemble exists
     */
    public boolean stopEnsemble(String ensembleId) {
        EnsembleSupervisor supervisor = ensembles.remove(ensembleId);
        rebuildWindows.remove(ensembleId);
        if (supervisor == null) {
            return false;
        }
        supervisor.stop();
        return true;
    }

    public Optional<EnsembleSupervisor> getEnsemble(String ensembleId) {
        return Optional.ofNullable(ensembles.get(ensembleId));
    }

    public Set<String> getEnsembleIds() {
        return new TreeSet<>(ensembles.keySet());
    }

    @Override
    public void onRestartRequired(EnsembleRestartRequired signal) {
        if (shutdown) {
            log.debug("Ignoring restart signal for ensemble={} during shutdown", signal.ensembleId());
            return;
        }
        log.warn("Ensemble={} generation={} requires restart: {}", signal.ensembleId(), signal.generation(), signal.reason());
        try {
            rebuilds.execute(() -> rebuild(signal));
        } catch (RejectedExecutionException e) {
            log.warn("Rebuild of ensemble={} rejected; orchestration is shutting down", signal.ensembleId());
        }
    }

    private void rebuild(EnsembleRestartRequired signal) {
        String ensembleId = signal.ensembleId();
        EnsembleSupervisor supervisor = ensembles.get(ensembleId);
        if (supervisor == null || shutdown) {
            return;
        }
        if (supervisor.getGeneration() != signal.generation()) {
            log.debug("Stale restart signal for ensemble={} generation={} (current={})",
                    ensembleId, signal.generation(), supervisor.getGeneration());
            return;
        }
        FailureWindow window = rebuildWindows.computeIfAbsent(ensembleId, id -> rebuildPolicy.newWindow());
        if (rebuildPolicy.decide(window) == SupervisionDecision.STOP) {
            log.error("Rebuilds exhausted for ensemble={} ({}); stopping and removing it", ensembleId, rebuildPolicy);
            ensembles.remove(ensembleId, supervisor);
            rebuildWindows.remove(ensembleId);
            supervisor.stop();
            return;
        }
        try {
            BuildOutcome outcome = supervisor.restart(signal.reason());
            log.info("Rebuilt ensemble={}: {}", ensembleId, outcome);
        } catch (IllegalStateException e) {
            log.warn("Could not rebuild ensemble={}: {}", ensembleId, e.getMessage());
        }
    }

    /**
     * Stops every ensemble and the rebuild thread. Idempotent.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        rebuilds.shutdown();
        try {
            if (!rebuilds.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                rebuilds.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            rebuilds.shutdownNow();
        }
        for (String ensembleId : getEnsembleIds()) {
            stopEnsemble(ensembleId);
        }
        log.info("Orchestration={} shut down", runtime.getOrchestrationId());
    }

    @Override
    public void close() {
        shutdown();
    }
}
