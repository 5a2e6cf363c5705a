package com.maestro.runtime.ensemble;

import java.util.List;

/**
 * The connections form a cycle; workers are built dependency first, so a cycle cannot be wired.
 */
public final class ConnectionCycleException extends EnsembleBuildException {

    private final List<String> cycle;

    public ConnectionCycleException(List<String> cycle) {
        super(cycle.isEmpty() ? null : cycle.get(0), "Connection cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Performer ids along the cycle; first and last are the same id. */
    public List<String> getCycle() {
        return cycle;
    }
}
