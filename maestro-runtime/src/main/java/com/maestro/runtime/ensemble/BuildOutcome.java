package com.maestro.runtime.ensemble;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of building an ensemble: a snapshot of the running ensemble, or the restart signal of a failed build.
 */
public final class BuildOutcome {

    private final EnsembleSnapshot snapshot;
    private final EnsembleRestartRequired signal;

    private BuildOutcome(EnsembleSnapshot snapshot, EnsembleRestartRequired signal) {
        this.snapshot = snapshot;
        this.signal = signal;
    }

    public static BuildOutcome success(EnsembleSnapshot snapshot) {
        return new BuildOutcome(Objects.requireNonNull(snapshot, "snapshot"), null);
    }

    public static BuildOutcome failed(EnsembleRestartRequired signal) {
        return new BuildOutcome(null, Objects.requireNonNull(signal, "signal"));
    }

    public boolean isSuccess() {
        return signal == null;
    }

    /** Snapshot after a successful build. */
    public Optional<EnsembleSnapshot> getSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    /** Restart signal of a failed build. */
    public Optional<EnsembleRestartRequired> getSignal() {
        return Optional.ofNullable(signal);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "BuildOutcome{success, generation=" + snapshot.generation() + "}"
                : "BuildOutcome{failed, reason=" + signal.reason() + "}";
    }
}
