package com.maestro.runtime.worker;

/**
 * Worker lifecycle: RUNNING → RESTARTING → (RUNNING | DEAD); STOPPED after a requested stop.
 */
public enum WorkerState {
    RUNNING,
    RESTARTING,
    DEAD,
    STOPPED;

    public boolean isTerminal() {
        return this == DEAD || this == STOPPED;
    }
}
